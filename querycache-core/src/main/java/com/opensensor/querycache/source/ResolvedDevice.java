package com.opensensor.querycache.source;

import java.util.List;

/**
 * Device identity as returned by a {@link DeviceResolver}.
 *
 * @param deviceIds every device id sharing the requested device's registration, in store order
 * @param deviceName display name of the device
 */
public record ResolvedDevice(List<String> deviceIds, String deviceName) {
}
