package com.opensensor.querycache.source;

/**
 * Raised by a {@link PipelineSource} for malformed pipelines or an unavailable document store.
 */
public class QueryException extends RuntimeException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
