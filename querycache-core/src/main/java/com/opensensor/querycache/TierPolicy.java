package com.opensensor.querycache;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Effective TTL per {@link Tier}. Tiers without an override use {@link Tier#defaultTtl()}.
 *
 * <p>Instances are built once at startup and only read afterwards.</p>
 *
 * @since 1.0.0
 */
public class TierPolicy {

    private final Map<Tier, Duration> ttls = new EnumMap<>(Tier.class);

    /**
     * @return a policy with no overrides
     */
    public static TierPolicy defaults() {
        return new TierPolicy();
    }

    /**
     * Overrides the TTL of one tier.
     *
     * @param tier the tier to override
     * @param ttl the new TTL, strictly positive
     * @return this policy
     * @throws IllegalArgumentException if {@code ttl} is null, zero or negative
     */
    public TierPolicy withTtl(Tier tier, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL for " + tier + " must be positive, was " + ttl);
        }
        ttls.put(tier, ttl);
        return this;
    }

    /**
     * @param tier the tier being written
     * @return the override for {@code tier}, or its default TTL
     */
    public Duration ttl(Tier tier) {
        return ttls.getOrDefault(tier, tier.defaultTtl());
    }
}
