package com.opensensor.querycache.resilience;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.serializer.SerializationException;
import com.opensensor.querycache.store.StoreHealth;
import com.opensensor.querycache.store.TieredStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * A TieredStore decorator that routes every backend call through a Resilience4j
 * {@link CircuitBreaker}.
 *
 * <p>While the breaker is OPEN, calls fail immediately with
 * {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException} instead of waiting for
 * the backend timeout. The surrounding {@link DegradingTieredStore} turns that into a miss, so
 * an outage costs one fast failure per request rather than one timeout per request.</p>
 *
 * <p>{@link #healthCheck()} bypasses the breaker so that observability endpoints can see when
 * the backend comes back.</p>
 *
 * <p>Only backend failures should trip the breaker. A value that cannot be serialized, or a
 * malformed key or pattern, says nothing about backend health; {@link #configBuilder()} starts a
 * configuration that ignores {@link SerializationException} and {@link IllegalArgumentException}.</p>
 *
 * @since 1.0.0
 */
public class CircuitBreakerTieredStore implements TieredStore {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerTieredStore.class);

    private final TieredStore delegate;
    private final CircuitBreaker circuitBreaker;

    /**
     * Starts a breaker configuration that records backend failures only.
     *
     * @return a builder ignoring {@link SerializationException} and {@link IllegalArgumentException}
     */
    public static CircuitBreakerConfig.Builder configBuilder() {
        return CircuitBreakerConfig.custom()
                .ignoreExceptions(SerializationException.class, IllegalArgumentException.class);
    }

    public CircuitBreakerTieredStore(TieredStore delegate, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Query cache circuit breaker state changed: {}", event));
    }

    @Override
    public <T> Optional<T> get(CacheKey key, ParameterizedTypeReference<T> typeRef) {
        return circuitBreaker.executeSupplier(() -> delegate.get(key, typeRef));
    }

    @Override
    public boolean set(CacheKey key, Object value, Duration ttl) {
        return circuitBreaker.executeSupplier(() -> delegate.set(key, value, ttl));
    }

    @Override
    public boolean delete(CacheKey key) {
        return circuitBreaker.executeSupplier(() -> delegate.delete(key));
    }

    @Override
    public long deleteByPattern(String pattern) {
        return circuitBreaker.executeSupplier(() -> delegate.deleteByPattern(pattern));
    }

    @Override
    public StoreHealth healthCheck() {
        return delegate.healthCheck();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
