package com.opensensor.querycache.starter;

import com.opensensor.querycache.Tier;
import com.opensensor.querycache.TierPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Configuration properties for the OpenSensor query cache.
 *
 * <p>All properties use the prefix {@code querycache}. The Redis connection itself is configured
 * through the standard {@code spring.data.redis.*} properties.</p>
 *
 * <p><strong>Example configuration:</strong></p>
 * <pre>{@code
 * querycache:
 *   namespace: opensensor
 *   max-entry-size: 1MB
 *   tiers:
 *     pipeline-result-ttl: 10m
 *   redis:
 *     command-timeout: 200ms
 *   circuit-breaker:
 *     wait-duration-in-open-state: 15s
 * }</pre>
 *
 * @see QueryCacheAutoConfiguration
 */
@ConfigurationProperties(prefix = "querycache")
public class QueryCacheProperties {

    /**
     * Backend holding the cache entries.
     */
    public enum Backend {
        /** Shared Redis server, the default. */
        REDIS,
        /** Process-local Caffeine cache. */
        CAFFEINE
    }

    /**
     * Whether caching is active. When false every lookup goes straight to the source.
     */
    private boolean enabled = true;

    /**
     * Prefix separating this system's keys from other tenants of the backend.
     */
    private String namespace = "opensensor";

    private Backend backend = Backend.REDIS;

    /**
     * Largest serialized entry admitted into the cache. Larger results are returned but not cached.
     */
    private DataSize maxEntrySize = DataSize.ofMegabytes(1);

    /**
     * Whether concurrent misses for the same key share one source call within this process.
     */
    private boolean dedupeInFlight = true;

    private TierProperties tiers = new TierProperties();

    private RedisStoreProperties redis = new RedisStoreProperties();

    private CaffeineStoreProperties caffeine = new CaffeineStoreProperties();

    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();

    public TierPolicy toTierPolicy() {
        return TierPolicy.defaults()
                .withTtl(Tier.DEVICE_METADATA, tiers.getDeviceMetadataTtl())
                .withTtl(Tier.PIPELINE_RESULT, tiers.getPipelineResultTtl())
                .withTtl(Tier.AGGREGATED_CHUNK, tiers.getAggregatedChunkTtl());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public DataSize getMaxEntrySize() {
        return maxEntrySize;
    }

    public void setMaxEntrySize(DataSize maxEntrySize) {
        this.maxEntrySize = maxEntrySize;
    }

    public boolean isDedupeInFlight() {
        return dedupeInFlight;
    }

    public void setDedupeInFlight(boolean dedupeInFlight) {
        this.dedupeInFlight = dedupeInFlight;
    }

    public TierProperties getTiers() {
        return tiers;
    }

    public void setTiers(TierProperties tiers) {
        this.tiers = tiers;
    }

    public RedisStoreProperties getRedis() {
        return redis;
    }

    public void setRedis(RedisStoreProperties redis) {
        this.redis = redis;
    }

    public CaffeineStoreProperties getCaffeine() {
        return caffeine;
    }

    public void setCaffeine(CaffeineStoreProperties caffeine) {
        this.caffeine = caffeine;
    }

    public CircuitBreakerProperties getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreakerProperties circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * Time to live per tier.
     */
    public static class TierProperties {

        private Duration deviceMetadataTtl = Tier.DEVICE_METADATA.defaultTtl();

        /**
         * Default TTL for pipeline results when the call-site does not pass one.
         */
        private Duration pipelineResultTtl = Tier.PIPELINE_RESULT.defaultTtl();

        private Duration aggregatedChunkTtl = Tier.AGGREGATED_CHUNK.defaultTtl();

        public Duration getDeviceMetadataTtl() {
            return deviceMetadataTtl;
        }

        public void setDeviceMetadataTtl(Duration deviceMetadataTtl) {
            this.deviceMetadataTtl = deviceMetadataTtl;
        }

        public Duration getPipelineResultTtl() {
            return pipelineResultTtl;
        }

        public void setPipelineResultTtl(Duration pipelineResultTtl) {
            this.pipelineResultTtl = pipelineResultTtl;
        }

        public Duration getAggregatedChunkTtl() {
            return aggregatedChunkTtl;
        }

        public void setAggregatedChunkTtl(Duration aggregatedChunkTtl) {
            this.aggregatedChunkTtl = aggregatedChunkTtl;
        }
    }

    /**
     * Redis backend settings.
     */
    public static class RedisStoreProperties {

        /**
         * Per-command timeout applied to the Lettuce client. A timed-out command counts as a miss.
         */
        private Duration commandTimeout = Duration.ofMillis(250);

        /**
         * COUNT hint for SCAN and the size of DEL batches during pattern deletes.
         */
        private int scanBatchSize = 500;

        public Duration getCommandTimeout() {
            return commandTimeout;
        }

        public void setCommandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
        }

        public int getScanBatchSize() {
            return scanBatchSize;
        }

        public void setScanBatchSize(int scanBatchSize) {
            this.scanBatchSize = scanBatchSize;
        }
    }

    /**
     * Caffeine backend settings.
     */
    public static class CaffeineStoreProperties {

        private long maximumSize = 10_000;

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }

    /**
     * Circuit breaker protecting the backend.
     *
     * <p>When the breaker opens, cache calls fail fast and are served as misses until the wait
     * duration has passed and trial calls succeed again.</p>
     */
    public static class CircuitBreakerProperties {

        private boolean enabled = true;

        /**
         * Failure rate percentage above which the breaker opens.
         */
        private float failureRateThreshold = 50.0f;

        /**
         * Slow call percentage above which the breaker opens.
         */
        private float slowCallRateThreshold = 100.0f;

        private Duration slowCallDurationThreshold = Duration.ofMillis(500);

        private int permittedNumberOfCallsInHalfOpenState = 10;

        private Duration waitDurationInOpenState = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public float getFailureRateThreshold() {
            return failureRateThreshold;
        }

        public void setFailureRateThreshold(float failureRateThreshold) {
            this.failureRateThreshold = failureRateThreshold;
        }

        public float getSlowCallRateThreshold() {
            return slowCallRateThreshold;
        }

        public void setSlowCallRateThreshold(float slowCallRateThreshold) {
            this.slowCallRateThreshold = slowCallRateThreshold;
        }

        public Duration getSlowCallDurationThreshold() {
            return slowCallDurationThreshold;
        }

        public void setSlowCallDurationThreshold(Duration slowCallDurationThreshold) {
            this.slowCallDurationThreshold = slowCallDurationThreshold;
        }

        public int getPermittedNumberOfCallsInHalfOpenState() {
            return permittedNumberOfCallsInHalfOpenState;
        }

        public void setPermittedNumberOfCallsInHalfOpenState(int permittedNumberOfCallsInHalfOpenState) {
            this.permittedNumberOfCallsInHalfOpenState = permittedNumberOfCallsInHalfOpenState;
        }

        public Duration getWaitDurationInOpenState() {
            return waitDurationInOpenState;
        }

        public void setWaitDurationInOpenState(Duration waitDurationInOpenState) {
            this.waitDurationInOpenState = waitDurationInOpenState;
        }
    }
}
