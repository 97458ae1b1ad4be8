package com.opensensor.querycache;

import java.time.Duration;

/**
 * Category of cached object. Every tier owns a disjoint key-space prefix and a default TTL.
 *
 * <p><strong>Tiers:</strong></p>
 * <ul>
 *   <li><strong>DEVICE_METADATA:</strong> resolved device-id sets and display names, keyed by device id</li>
 *   <li><strong>PIPELINE_RESULT:</strong> aggregation-pipeline output, keyed by a content hash of the pipeline</li>
 *   <li><strong>AGGREGATED_CHUNK:</strong> pre-aggregated readings per data type, device, time bucket and resolution</li>
 * </ul>
 *
 * @see CacheKey
 * @see TierPolicy
 */
public enum Tier {
    DEVICE_METADATA("device_meta", Duration.ofHours(24)),
    PIPELINE_RESULT("pipeline", Duration.ofMinutes(15)),
    AGGREGATED_CHUNK("agg", Duration.ofMinutes(30));

    private final String prefix;
    private final Duration defaultTtl;

    Tier(String prefix, Duration defaultTtl) {
        this.prefix = prefix;
        this.defaultTtl = defaultTtl;
    }

    public String prefix() {
        return prefix;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    /**
     * Finds the tier owning a namespace-relative key.
     *
     * @param key a key such as {@code device_meta:A}
     * @return the owning tier, or {@code null} when the prefix is unknown
     */
    public static Tier ofKey(String key) {
        if (key == null) {
            return null;
        }
        int colon = key.indexOf(':');
        if (colon == -1) {
            return null;
        }
        String prefix = key.substring(0, colon);
        for (Tier tier : values()) {
            if (tier.prefix.equals(prefix)) {
                return tier;
            }
        }
        return null;
    }
}
