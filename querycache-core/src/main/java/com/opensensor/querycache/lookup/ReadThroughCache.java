package com.opensensor.querycache.lookup;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.store.TieredStore;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Cache-check, execute-on-miss, populate-on-success. Shared by the cache-aware call-sites.
 *
 * <p>The store passed in is expected to be degradation-wrapped, so this class never sees cache
 * failures: an unavailable cache is just a miss followed by an ignored write. Exceptions thrown
 * by the loader propagate unchanged and nothing is written.</p>
 */
public class ReadThroughCache {

    private static final Logger log = LoggerFactory.getLogger(ReadThroughCache.class);

    private final TieredStore store;
    private final InFlightLoads inFlightLoads;

    /**
     * @param store the degradation-wrapped store
     * @param inFlightLoads per-key de-duplication, or null to let concurrent misses each run the loader
     */
    public ReadThroughCache(TieredStore store, InFlightLoads inFlightLoads) {
        this.store = store;
        this.inFlightLoads = inFlightLoads;
        log.info("ReadThroughCache initialized. Store: {}, In-flight de-duplication: {}",
                store.getClass().getSimpleName(), inFlightLoads != null);
    }

    /**
     * @param key cache key of the value
     * @param typeRef full generic type of the value
     * @param loader authoritative source, invoked on a miss
     * @param cacheable decides whether a loaded value may be written
     * @param ttl TTL for the written value
     * @return the cached or freshly loaded value
     */
    public <T> T getOrLoad(
            CacheKey key,
            ParameterizedTypeReference<T> typeRef,
            Supplier<T> loader,
            Predicate<T> cacheable,
            Duration ttl) {
        Optional<T> cached = store.get(key, typeRef);
        if (cached.isPresent()) {
            log.debug("Cache HIT for key: {}", key);
            return cached.get();
        }

        Supplier<T> missPath = () -> {
            log.debug("Cache MISS for key: {}. Executing loader.", key);
            T value = loader.get();
            if (cacheable.test(value)) {
                store.set(key, value, ttl);
            } else {
                log.debug("Loaded value for key {} is not cacheable, skipping write", key);
            }
            return value;
        };
        return inFlightLoads != null ? inFlightLoads.load(key, missPath) : missPath.get();
    }

    public TieredStore getStore() {
        return store;
    }
}
