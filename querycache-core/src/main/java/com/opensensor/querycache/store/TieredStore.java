package com.opensensor.querycache.store;

import com.opensensor.querycache.CacheKey;
import java.time.Duration;
import java.util.Optional;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Key-value store with per-entry TTL, shared by every replica of the serving process.
 *
 * <p>Keys are namespace-relative ({@code device_meta:A}); implementations prepend the configured
 * namespace before talking to the backend, and {@link #deleteByPattern(String)} patterns are
 * resolved the same way.</p>
 *
 * <p><strong>Failure contract:</strong> backends may throw {@link CacheUnavailableException} or
 * {@link com.opensensor.querycache.serializer.SerializationException}. The store handed to the
 * cache-aware call-sites is always wrapped by
 * {@link com.opensensor.querycache.resilience.DegradingTieredStore}, which turns every such
 * failure into a miss, {@code false} or {@code 0}. Only {@link #healthCheck()} reports backend
 * status explicitly.</p>
 *
 * @see BinaryTieredStore
 */
public interface TieredStore {

    /**
     * Reads a cached value.
     *
     * @param <T> the expected value type
     * @param key the cache key
     * @param typeRef the full generic type of the value
     * @return the value when present, empty otherwise
     */
    <T> Optional<T> get(CacheKey key, ParameterizedTypeReference<T> typeRef);

    /**
     * Stores a value with the given TTL, subject to size admission.
     *
     * @param key the cache key
     * @param value the value to store; null values are never stored
     * @param ttl time to live, must be positive
     * @return {@code true} when the value was written, {@code false} when it was rejected or failed
     */
    boolean set(CacheKey key, Object value, Duration ttl);

    /**
     * Removes one key.
     *
     * @return {@code true} when the key existed and was removed
     */
    boolean delete(CacheKey key);

    /**
     * Removes every key matching a glob pattern ({@code *}, {@code ?}, {@code [..]}, {@code \}
     * escapes), for example {@code agg:*:A:*}.
     *
     * @param pattern namespace-relative glob pattern
     * @return number of keys removed
     */
    long deleteByPattern(String pattern);

    /** Reports availability and backend statistics. */
    StoreHealth healthCheck();
}
