package com.opensensor.querycache.invalidation;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.KeyCodec;
import com.opensensor.querycache.store.TieredStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Purges cache entries made stale by newly recorded readings.
 *
 * <p>Must be called after the write has been acknowledged by the document store; calling it
 * earlier lets a racing read repopulate the cache with pre-write data.</p>
 *
 * <p><strong>Scope of one invalidation:</strong></p>
 * <ul>
 *   <li>the device's metadata entry</li>
 *   <li>every aggregated chunk of the device, across data types, buckets and resolutions</li>
 * </ul>
 *
 * <p>Pipeline results are not touched: their keys are one-way hashes that carry no device
 * identity, so they expire on their TTL.</p>
 *
 * <p>Never throws because of the cache. An unavailable backend yields a count of zero and the
 * write stays acknowledged; the entries then age out on their TTL.</p>
 *
 * @since 1.0.0
 */
public class Invalidator {

    private static final Logger log = LoggerFactory.getLogger(Invalidator.class);

    private final TieredStore store;
    private final KeyCodec keyCodec;

    /**
     * @param store the fully decorated store, so backend failures degrade to zero
     * @param keyCodec codec producing the metadata key and chunk pattern
     */
    public Invalidator(TieredStore store, KeyCodec keyCodec) {
        this.store = store;
        this.keyCodec = keyCodec;
    }

    /**
     * @param deviceId device that received new readings
     * @return number of cache keys removed
     * @throws IllegalArgumentException if {@code deviceId} is null or blank
     */
    public long onDataWritten(String deviceId) {
        CacheKey metadataKey = keyCodec.deriveMetadataKey(deviceId);
        long removed = store.delete(metadataKey) ? 1 : 0;
        removed += store.deleteByPattern(keyCodec.chunkPatternForDevice(deviceId));
        log.debug("Invalidated {} cache keys for device: {}", removed, deviceId);
        return removed;
    }
}
