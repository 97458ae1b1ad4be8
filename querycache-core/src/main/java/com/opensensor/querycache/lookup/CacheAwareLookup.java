package com.opensensor.querycache.lookup;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.KeyCodec;
import com.opensensor.querycache.Tier;
import com.opensensor.querycache.TierPolicy;
import com.opensensor.querycache.source.DeviceResolver;
import com.opensensor.querycache.source.ResolvedDevice;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.springframework.core.ParameterizedTypeReference;

/**
 * Device metadata lookup through the {@link Tier#DEVICE_METADATA} tier.
 *
 * <p>A hit returns the cached record. A miss asks the {@link DeviceResolver}, stamps the record
 * with the current time and caches it for the metadata TTL. Resolver errors such as
 * {@link com.opensensor.querycache.source.DeviceNotFoundException} reach the caller unchanged and
 * are never cached.</p>
 *
 * @since 1.0.0
 * @see DeviceMetadataRecord
 */
public class CacheAwareLookup {

    private static final ParameterizedTypeReference<DeviceMetadataRecord> RECORD_TYPE =
            new ParameterizedTypeReference<>() {};

    private final ReadThroughCache cache;
    private final KeyCodec keyCodec;
    private final TierPolicy tierPolicy;
    private final DeviceResolver resolver;
    private final Clock clock;

    public CacheAwareLookup(
            ReadThroughCache cache,
            KeyCodec keyCodec,
            TierPolicy tierPolicy,
            DeviceResolver resolver,
            Clock clock) {
        this.cache = cache;
        this.keyCodec = keyCodec;
        this.tierPolicy = tierPolicy;
        this.resolver = resolver;
        this.clock = clock;
    }

    /**
     * Returns the metadata of one device, from the cache when present.
     *
     * @param deviceId the device to resolve
     * @return the cached record, or a freshly resolved one stamped with the clock's current instant
     * @throws IllegalArgumentException if {@code deviceId} is null or blank
     * @throws com.opensensor.querycache.source.DeviceNotFoundException if the resolver knows no
     *     such device
     */
    public DeviceMetadataRecord lookup(String deviceId) {
        CacheKey key = keyCodec.deriveMetadataKey(deviceId);
        return cache.getOrLoad(
                key,
                RECORD_TYPE,
                () -> resolve(deviceId),
                Objects::nonNull,
                tierPolicy.ttl(Tier.DEVICE_METADATA));
    }

    private DeviceMetadataRecord resolve(String deviceId) {
        ResolvedDevice resolved = resolver.resolve(deviceId);
        return new DeviceMetadataRecord(
                List.copyOf(resolved.deviceIds()), resolved.deviceName(), clock.instant());
    }
}
