package com.opensensor.querycache.starter.actuator;

import com.opensensor.querycache.store.StoreHealth;
import com.opensensor.querycache.store.TieredStore;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.InvalidEndpointRequestException;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.lang.Nullable;

/**
 * Administrative surface: {@code GET /actuator/cache/stats}, {@code POST /actuator/cache/clear}
 * and {@code POST /actuator/cache/invalidate} with body {@code {"pattern": "agg:*:A:*"}}.
 * Patterns are relative to the cache namespace.
 */
@Endpoint(id = "cache")
public class QueryCacheEndpoint {

    static final String STATS = "stats";
    static final String CLEAR = "clear";
    static final String INVALIDATE = "invalidate";

    private final TieredStore tieredStore;

    public QueryCacheEndpoint(TieredStore tieredStore) {
        this.tieredStore = tieredStore;
    }

    @ReadOperation
    public Map<String, Object> read(@Selector String action) {
        if (!STATS.equals(action)) {
            return null;
        }
        StoreHealth health = tieredStore.healthCheck();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("status", health.status());
        stats.put("key_count", health.keyCount());
        stats.put("backend_version", health.backendVersion());
        stats.put("used_memory", health.usedMemory());
        stats.put("hits", health.hits());
        stats.put("misses", health.misses());
        stats.put("hit_rate", health.hitRate());
        return stats;
    }

    @WriteOperation
    public Map<String, Object> write(@Selector String action, @Nullable String pattern) {
        Map<String, Object> response = new LinkedHashMap<>();
        if (CLEAR.equals(action)) {
            response.put("deleted", tieredStore.deleteByPattern("*"));
            return response;
        }
        if (INVALIDATE.equals(action)) {
            if (pattern == null || pattern.isBlank()) {
                throw new InvalidEndpointRequestException("A pattern is required", "Missing pattern");
            }
            response.put("pattern", pattern);
            response.put("deleted", tieredStore.deleteByPattern(pattern));
            return response;
        }
        throw new InvalidEndpointRequestException("Unknown cache action: " + action, "Unknown action");
    }
}
