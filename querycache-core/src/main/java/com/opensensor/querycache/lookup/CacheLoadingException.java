package com.opensensor.querycache.lookup;

/**
 * Thrown when a thread waiting on an in-flight load is interrupted, or when the load failed with
 * something other than an unchecked exception.
 */
public class CacheLoadingException extends RuntimeException {

    public CacheLoadingException(String message, Throwable cause) {
        super(message, cause);
    }
}
