package com.opensensor.querycache.store;

import com.opensensor.querycache.CacheKey;
import java.time.Duration;
import java.util.Optional;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Store used when caching is switched off: every read misses and nothing is kept, so the
 * cache-aware call-sites always go to the source.
 */
public class NoOpTieredStore implements TieredStore {

    @Override
    public <T> Optional<T> get(CacheKey key, ParameterizedTypeReference<T> typeRef) {
        return Optional.empty();
    }

    @Override
    public boolean set(CacheKey key, Object value, Duration ttl) {
        return false;
    }

    @Override
    public boolean delete(CacheKey key) {
        return false;
    }

    @Override
    public long deleteByPattern(String pattern) {
        return 0;
    }

    @Override
    public StoreHealth healthCheck() {
        return new StoreHealth(false, 0, "disabled", "0B", 0, 0);
    }
}
