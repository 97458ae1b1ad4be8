package com.opensensor.querycache.serializer;

/**
 * Thrown when a value cannot be encoded for, or decoded from, the cache.
 *
 * <p>The store stack treats it like an unavailable backend for that single operation: a read
 * becomes a miss and a write is skipped. It never reaches callers of the cache-aware call-sites.</p>
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
