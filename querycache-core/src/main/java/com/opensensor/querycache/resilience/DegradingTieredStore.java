package com.opensensor.querycache.resilience;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.serializer.SerializationException;
import com.opensensor.querycache.store.StoreHealth;
import com.opensensor.querycache.store.TieredStore;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Outermost TieredStore decorator. Any failure of the wrapped stack is absorbed here and reported
 * as the neutral outcome of the operation:
 *
 * <ul>
 *   <li>{@code get} returns empty</li>
 *   <li>{@code set} and {@code delete} return {@code false}</li>
 *   <li>{@code deleteByPattern} returns {@code 0}</li>
 *   <li>{@code healthCheck} returns a disconnected {@link StoreHealth}</li>
 * </ul>
 *
 * <p>Nothing is retried. Serialization failures are logged at WARN since they point at a value the
 * backend can never hold; every other failure is an unavailable backend and is logged at DEBUG.</p>
 *
 * <p>Argument errors ({@link IllegalArgumentException}) are caller bugs and propagate.</p>
 */
public class DegradingTieredStore implements TieredStore {

    private static final Logger log = LoggerFactory.getLogger(DegradingTieredStore.class);

    private final TieredStore delegate;

    public DegradingTieredStore(TieredStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public <T> Optional<T> get(CacheKey key, ParameterizedTypeReference<T> typeRef) {
        try {
            return delegate.get(key, typeRef);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            logFailure("get", key.value(), e);
            return Optional.empty();
        }
    }

    @Override
    public boolean set(CacheKey key, Object value, Duration ttl) {
        try {
            return delegate.set(key, value, ttl);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            logFailure("set", key.value(), e);
            return false;
        }
    }

    @Override
    public boolean delete(CacheKey key) {
        try {
            return delegate.delete(key);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            logFailure("delete", key.value(), e);
            return false;
        }
    }

    @Override
    public long deleteByPattern(String pattern) {
        try {
            return delegate.deleteByPattern(pattern);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            logFailure("deleteByPattern", pattern, e);
            return 0;
        }
    }

    @Override
    public StoreHealth healthCheck() {
        try {
            return delegate.healthCheck();
        } catch (RuntimeException e) {
            logFailure("healthCheck", "-", e);
            return StoreHealth.disconnected();
        }
    }

    private void logFailure(String operation, String target, RuntimeException e) {
        if (e instanceof SerializationException) {
            log.warn("Cache {} skipped for {}: {}", operation, target, e.getMessage());
        } else {
            log.debug("Cache {} failed for {}, treating as miss: {}", operation, target, e.toString());
        }
    }
}
