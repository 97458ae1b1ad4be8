package com.opensensor.querycache.source;

import java.util.List;
import java.util.Map;

/**
 * The document store's aggregation engine.
 */
@FunctionalInterface
public interface PipelineSource {

    /**
     * Runs an aggregation pipeline.
     *
     * @param pipeline ordered pipeline stages
     * @return the output documents in pipeline order
     * @throws QueryException if the pipeline is malformed or the store is unavailable
     */
    List<Map<String, Object>> executePipeline(List<Map<String, Object>> pipeline);
}
