package com.opensensor.querycache.store;

import java.util.Locale;

/**
 * Availability and statistics of a {@link TieredStore} backend.
 *
 * @param available whether the backend answered
 * @param keyCount number of keys under this system's namespace
 * @param backendVersion backend name or version string
 * @param usedMemory human readable memory footprint reported by the backend
 * @param hits successful key lookups recorded by the backend
 * @param misses failed key lookups recorded by the backend
 */
public record StoreHealth(
        boolean available,
        long keyCount,
        String backendVersion,
        String usedMemory,
        long hits,
        long misses) {

    public static StoreHealth disconnected() {
        return new StoreHealth(false, 0, "unknown", "unknown", 0, 0);
    }

    public String status() {
        return available ? "connected" : "disconnected";
    }

    /** Hit rate as a percentage string with two decimals, {@code 0.00%} when nothing was read. */
    public String hitRate() {
        long total = hits + misses;
        double rate = total == 0 ? 0.0 : (hits * 100.0) / total;
        return String.format(Locale.ROOT, "%.2f%%", rate);
    }
}
