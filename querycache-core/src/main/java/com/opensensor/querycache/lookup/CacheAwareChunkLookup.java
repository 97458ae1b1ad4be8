package com.opensensor.querycache.lookup;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.KeyCodec;
import com.opensensor.querycache.Tier;
import com.opensensor.querycache.TierPolicy;
import com.opensensor.querycache.TimeBuckets;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Pre-aggregated readings through the {@link Tier#AGGREGATED_CHUNK} tier, one entry per data type,
 * device, time bucket and resolution. Entries are purged per device by the
 * {@link com.opensensor.querycache.invalidation.Invalidator}.
 *
 * @since 1.0.0
 */
public class CacheAwareChunkLookup {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> CHUNK_TYPE =
            new ParameterizedTypeReference<>() {};

    private final ReadThroughCache cache;
    private final KeyCodec keyCodec;
    private final TierPolicy tierPolicy;

    public CacheAwareChunkLookup(ReadThroughCache cache, KeyCodec keyCodec, TierPolicy tierPolicy) {
        this.cache = cache;
        this.keyCodec = keyCodec;
        this.tierPolicy = tierPolicy;
    }

    /**
     * @param dataType reading type, e.g. {@code temp}
     * @param deviceId device the chunk belongs to
     * @param timestamp any instant inside the wanted bucket
     * @param resolutionMinutes aggregation resolution, also selects the bucket width
     * @param aggregator computes the chunk on a miss
     * @return the chunk documents, as an unmodifiable list
     * @throws IllegalArgumentException if a key component is invalid
     */
    public List<Map<String, Object>> fetch(
            String dataType,
            String deviceId,
            Instant timestamp,
            int resolutionMinutes,
            Supplier<List<Map<String, Object>>> aggregator) {
        String bucket = TimeBuckets.bucketFor(timestamp, resolutionMinutes);
        CacheKey key = keyCodec.deriveChunkKey(dataType, deviceId, bucket, resolutionMinutes);
        List<Map<String, Object>> chunk = cache.getOrLoad(
                key,
                CHUNK_TYPE,
                aggregator,
                loaded -> loaded != null && !loaded.isEmpty(),
                tierPolicy.ttl(Tier.AGGREGATED_CHUNK));
        return chunk == null ? null : Collections.unmodifiableList(chunk);
    }
}
