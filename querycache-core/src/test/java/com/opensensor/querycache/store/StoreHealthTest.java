package com.opensensor.querycache.store;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StoreHealth")
class StoreHealthTest {

    @Test
    @DisplayName("hit rate is a two-decimal percentage")
    void hitRate() {
        assertThat(new StoreHealth(true, 3, "7.2.4", "1.2M", 7, 1).hitRate()).isEqualTo("87.50%");
        assertThat(new StoreHealth(true, 3, "7.2.4", "1.2M", 1, 2).hitRate()).isEqualTo("33.33%");
    }

    @Test
    @DisplayName("hit rate is zero when nothing was read")
    void hitRateWithoutReads() {
        assertThat(new StoreHealth(true, 0, "7.2.4", "1M", 0, 0).hitRate()).isEqualTo("0.00%");
    }

    @Test
    @DisplayName("disconnected health reports its status")
    void disconnected() {
        StoreHealth health = StoreHealth.disconnected();

        assertThat(health.available()).isFalse();
        assertThat(health.status()).isEqualTo("disconnected");
        assertThat(new StoreHealth(true, 0, "x", "y", 0, 0).status()).isEqualTo("connected");
    }
}
