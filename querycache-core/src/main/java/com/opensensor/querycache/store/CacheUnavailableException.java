package com.opensensor.querycache.store;

/**
 * The cache backend could not be reached or did not answer within its timeout.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
