package com.opensensor.querycache.source;

/**
 * Authoritative lookup of a device's identity in the backing store.
 */
@FunctionalInterface
public interface DeviceResolver {

    /**
     * Resolves the device-id set and display name registered for a device.
     *
     * @param deviceId the id the client asked for
     * @return the resolved identity
     * @throws DeviceNotFoundException if the id is not registered
     */
    ResolvedDevice resolve(String deviceId);
}
