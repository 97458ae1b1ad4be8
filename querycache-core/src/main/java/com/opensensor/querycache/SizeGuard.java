package com.opensensor.querycache;

/**
 * Admission control for cache population. A candidate is admitted when its serialized form is no
 * larger than the configured ceiling; the ceiling itself is admitted.
 *
 * <p>Rejection only suppresses caching. The value computed by the source is still handed back to
 * the caller unchanged.</p>
 *
 * @since 1.0.0
 */
public class SizeGuard {

    /** 1 MiB. */
    public static final long DEFAULT_MAX_BYTES = 1024L * 1024L;

    private final long maxBytes;

    public SizeGuard() {
        this(DEFAULT_MAX_BYTES);
    }

    /**
     * @param maxBytes largest admitted serialized size in bytes
     * @throws IllegalArgumentException if {@code maxBytes} is negative
     */
    public SizeGuard(long maxBytes) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must not be negative: " + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    /**
     * Decides whether a serialized value may be written.
     *
     * @param serializedSize length in bytes of the exact payload that would be stored
     * @return {@code true} if {@code serializedSize <= maxBytes}
     */
    public boolean admit(long serializedSize) {
        return serializedSize <= maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
