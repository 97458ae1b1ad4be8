package com.opensensor.querycache.source;

/**
 * Raised by a {@link DeviceResolver} when the requested device id is not registered.
 */
public class DeviceNotFoundException extends RuntimeException {

    private final String deviceId;

    public DeviceNotFoundException(String deviceId) {
        super("Device not found: " + deviceId);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
