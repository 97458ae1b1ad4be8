package com.opensensor.querycache;

import java.util.Objects;

/**
 * A namespace-relative cache key: the tier prefix followed by a deterministic suffix.
 *
 * <p>The suffix is the raw identifier for metadata and chunk keys and a fixed-length content hash
 * for pipeline keys. Instances are created through {@link KeyCodec}.</p>
 *
 * @param tier the tier this key belongs to
 * @param suffix the tier-specific identifier
 */
public record CacheKey(Tier tier, String suffix) {

    public CacheKey {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(suffix, "suffix");
    }

    /** The string form stored in the backend, without the namespace prefix. */
    public String value() {
        return tier.prefix() + ":" + suffix;
    }

    @Override
    public String toString() {
        return value();
    }
}
