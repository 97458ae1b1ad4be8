package com.opensensor.querycache.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.KeyCodec;
import com.opensensor.querycache.SizeGuard;
import com.opensensor.querycache.serializer.JacksonCacheSerializer;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;

@DisplayName("BinaryTieredStore")
class BinaryTieredStoreTest {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> DOCUMENTS =
            new ParameterizedTypeReference<>() {};
    private static final Duration TTL = Duration.ofMinutes(15);

    private final KeyCodec keyCodec = new KeyCodec();

    @Nested
    @DisplayName("Admission")
    class Admission {

        private final List<Map<String, Object>> result = List.of(Map.of("device_id", "A", "avg", 21.5));
        private final int resultSize = new JacksonCacheSerializer().serialize(result).length;
        private final CacheKey key = keyCodec.deriveMetadataKey("A");

        @Test
        @DisplayName("admits a value serializing to exactly the ceiling")
        void admitsAtCeiling() {
            InMemoryTieredStore store = new InMemoryTieredStore(new SizeGuard(resultSize));

            assertThat(store.set(key, result, TTL)).isTrue();
            assertThat(store.get(key, DOCUMENTS)).contains(result);
        }

        @Test
        @DisplayName("rejects a value one byte over the ceiling")
        void rejectsOneByteOver() {
            InMemoryTieredStore store = new InMemoryTieredStore(new SizeGuard(resultSize - 1));

            assertThat(store.set(key, result, TTL)).isFalse();
            assertThat(store.get(key, DOCUMENTS)).isEmpty();
            assertThat(store.size()).isZero();
        }
    }

    @Test
    @DisplayName("keys are stored under the namespace with the requested TTL")
    void namespacesKeys() {
        InMemoryTieredStore store = new InMemoryTieredStore();
        CacheKey key = keyCodec.deriveMetadataKey("A");

        store.set(key, List.of(Map.of("a", 1)), TTL);

        assertThat(store.getNamespace()).isEqualTo("opensensor");
        assertThat(store.containsKey("device_meta:A")).isTrue();
        assertThat(store.ttlOf("device_meta:A")).isEqualTo(TTL);
    }

    @Test
    @DisplayName("null values and non-positive TTLs are never written")
    void refusesNullAndBadTtl() {
        InMemoryTieredStore store = new InMemoryTieredStore();
        CacheKey key = keyCodec.deriveMetadataKey("A");

        assertThat(store.set(key, null, TTL)).isFalse();
        assertThat(store.set(key, List.of(), Duration.ZERO)).isFalse();
        assertThat(store.set(key, List.of(), Duration.ofSeconds(-1))).isFalse();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("delete reports whether the key existed")
    void deleteReportsExistence() {
        InMemoryTieredStore store = new InMemoryTieredStore();
        CacheKey key = keyCodec.deriveMetadataKey("A");
        store.set(key, List.of(Map.of("a", 1)), TTL);

        assertThat(store.delete(key)).isTrue();
        assertThat(store.delete(key)).isFalse();
    }

    @Test
    @DisplayName("blank patterns are rejected")
    void blankPattern() {
        assertThatThrownBy(() -> new InMemoryTieredStore().deleteByPattern(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("namespace must not be blank")
    void blankNamespace() {
        assertThatThrownBy(() -> new RejectingStore(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RejectingStore extends BinaryTieredStore {
        RejectingStore(String namespace) {
            super(namespace, new JacksonCacheSerializer(), new SizeGuard());
        }

        @Override
        protected byte[] read(String qualifiedKey) {
            return null;
        }

        @Override
        protected void write(String qualifiedKey, byte[] data, Duration ttl) {
        }

        @Override
        protected boolean remove(String qualifiedKey) {
            return false;
        }

        @Override
        protected long removeMatching(String qualifiedPattern) {
            return 0;
        }

        @Override
        public StoreHealth healthCheck() {
            return StoreHealth.disconnected();
        }
    }
}
