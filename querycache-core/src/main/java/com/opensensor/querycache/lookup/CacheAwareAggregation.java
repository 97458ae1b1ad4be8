package com.opensensor.querycache.lookup;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.KeyCodec;
import com.opensensor.querycache.Tier;
import com.opensensor.querycache.TierPolicy;
import com.opensensor.querycache.serializer.SerializationException;
import com.opensensor.querycache.source.PipelineSource;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Aggregation-pipeline execution through the {@link Tier#PIPELINE_RESULT} tier.
 *
 * <p>Results are keyed by the content hash of the pipeline without its trailing pagination
 * stages. Two pipelines that differ only in {@code $skip}/{@code $limit} therefore share one
 * entry, and {@link #execute} returns whatever the first of them produced. Callers that paginate
 * should use {@link #executePage}, which caches the unpaginated result and slices it after the
 * cache read.</p>
 *
 * <p>Empty results are never cached. {@link com.opensensor.querycache.source.QueryException}
 * from the source propagates unchanged.</p>
 *
 * <p>Returned lists are unmodifiable: concurrent callers joining one load receive the same
 * documents.</p>
 *
 * @since 1.0.0
 */
public class CacheAwareAggregation {

    private static final Logger log = LoggerFactory.getLogger(CacheAwareAggregation.class);

    private static final ParameterizedTypeReference<List<Map<String, Object>>> RESULT_TYPE =
            new ParameterizedTypeReference<>() {};

    private final ReadThroughCache cache;
    private final KeyCodec keyCodec;
    private final TierPolicy tierPolicy;
    private final PipelineSource source;

    public CacheAwareAggregation(
            ReadThroughCache cache, KeyCodec keyCodec, TierPolicy tierPolicy, PipelineSource source) {
        this.cache = cache;
        this.keyCodec = keyCodec;
        this.tierPolicy = tierPolicy;
        this.source = source;
    }

    /** Executes with the configured pipeline-result TTL. */
    public List<Map<String, Object>> execute(List<Map<String, Object>> pipeline) {
        return execute(pipeline, tierPolicy.ttl(Tier.PIPELINE_RESULT));
    }

    /**
     * Executes a pipeline, serving it from the cache when an entry for its key exists.
     *
     * @param pipeline ordered pipeline stages
     * @param ttl TTL for a freshly cached result, independent of the tier default
     * @return the result documents, as an unmodifiable list
     * @throws IllegalArgumentException if the TTL is not positive
     */
    public List<Map<String, Object>> execute(List<Map<String, Object>> pipeline, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, was " + ttl);
        }
        CacheKey key;
        try {
            key = keyCodec.derivePipelineKey(pipeline);
        } catch (SerializationException e) {
            log.warn("Pipeline cannot be keyed, bypassing cache: {}", e.getMessage());
            return readOnly(source.executePipeline(pipeline));
        }
        return readOnly(cache.getOrLoad(
                key,
                RESULT_TYPE,
                () -> source.executePipeline(pipeline),
                result -> result != null && !result.isEmpty(),
                ttl));
    }

    /**
     * Executes the pipeline without its trailing pagination stages and applies {@code skip} and
     * {@code limit} to the (possibly cached) full result.
     */
    public List<Map<String, Object>> executePage(
            List<Map<String, Object>> pipeline, long skip, long limit, Duration ttl) {
        if (skip < 0 || limit <= 0) {
            throw new IllegalArgumentException("skip must be >= 0 and limit > 0, was " + skip + "/" + limit);
        }
        List<Map<String, Object>> unpaginated = KeyCodec.withoutTrailingPagination(pipeline);
        return execute(unpaginated, ttl).stream().skip(skip).limit(limit).toList();
    }

    private static List<Map<String, Object>> readOnly(List<Map<String, Object>> result) {
        return result == null ? null : Collections.unmodifiableList(result);
    }
}
