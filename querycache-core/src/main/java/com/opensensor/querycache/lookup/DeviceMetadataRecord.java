package com.opensensor.querycache.lookup;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Cached identity of a device.
 *
 * @param deviceIds every device id sharing the device's registration, in store order
 * @param deviceName display name
 * @param cachedAt when the record was built from the source
 */
public record DeviceMetadataRecord(
        @JsonProperty("device_ids") List<String> deviceIds,
        @JsonProperty("device_name") String deviceName,
        @JsonProperty("cached_at") Instant cachedAt) {
}
