package com.opensensor.querycache.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.KeyCodec;
import com.opensensor.querycache.serializer.SerializationException;
import com.opensensor.querycache.store.CacheUnavailableException;
import com.opensensor.querycache.store.StoreHealth;
import com.opensensor.querycache.store.TieredStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.ParameterizedTypeReference;

@ExtendWith(MockitoExtension.class)
@DisplayName("DegradingTieredStore")
class DegradingTieredStoreTest {

    private static final ParameterizedTypeReference<String> TYPE = new ParameterizedTypeReference<>() {};
    private static final CacheUnavailableException UNAVAILABLE =
            new CacheUnavailableException("Redis GET failed", new IOException("connection refused"));

    @Mock private TieredStore delegate;

    private DegradingTieredStore store;
    private final CacheKey key = new KeyCodec().deriveMetadataKey("A");

    @BeforeEach
    void setUp() {
        store = new DegradingTieredStore(delegate);
    }

    @Nested
    @DisplayName("when the backend fails")
    class BackendFailure {

        @Test
        @DisplayName("get returns empty")
        void getIsMiss() {
            when(delegate.get(key, TYPE)).thenThrow(UNAVAILABLE);

            assertThat(store.get(key, TYPE)).isEmpty();
        }

        @Test
        @DisplayName("a serialization failure on get is a miss")
        void serializationFailureIsMiss() {
            when(delegate.get(key, TYPE)).thenThrow(new SerializationException("bad bytes", new IOException()));

            assertThat(store.get(key, TYPE)).isEmpty();
        }

        @Test
        @DisplayName("set and delete return false")
        void writesReturnFalse() {
            when(delegate.set(any(), any(), any())).thenThrow(UNAVAILABLE);
            when(delegate.delete(key)).thenThrow(UNAVAILABLE);

            assertThat(store.set(key, "value", Duration.ofMinutes(1))).isFalse();
            assertThat(store.delete(key)).isFalse();
        }

        @Test
        @DisplayName("deleteByPattern returns zero")
        void patternDeleteReturnsZero() {
            when(delegate.deleteByPattern(anyString())).thenThrow(UNAVAILABLE);

            assertThat(store.deleteByPattern("agg:*:A:*")).isZero();
        }

        @Test
        @DisplayName("an open circuit is a miss")
        void openCircuitIsMiss() {
            CircuitBreaker breaker = CircuitBreaker.ofDefaults("test");
            breaker.transitionToOpenState();
            when(delegate.get(key, TYPE)).thenThrow(CallNotPermittedException.createCallNotPermittedException(breaker));

            assertThat(store.get(key, TYPE)).isEmpty();
        }

        @Test
        @DisplayName("healthCheck reports disconnected")
        void healthIsDisconnected() {
            when(delegate.healthCheck()).thenThrow(UNAVAILABLE);

            StoreHealth health = store.healthCheck();

            assertThat(health.available()).isFalse();
            assertThat(health.status()).isEqualTo("disconnected");
        }
    }

    @Test
    @DisplayName("passes results through when the backend is healthy")
    void passThrough() {
        when(delegate.get(key, TYPE)).thenReturn(Optional.of("cached"));
        when(delegate.deleteByPattern("agg:*:A:*")).thenReturn(3L);

        assertThat(store.get(key, TYPE)).contains("cached");
        assertThat(store.deleteByPattern("agg:*:A:*")).isEqualTo(3L);
    }

    @Test
    @DisplayName("argument errors are not absorbed")
    void argumentErrorsPropagate() {
        when(delegate.deleteByPattern(" ")).thenThrow(new IllegalArgumentException("pattern must not be blank"));

        assertThatThrownBy(() -> store.deleteByPattern(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
