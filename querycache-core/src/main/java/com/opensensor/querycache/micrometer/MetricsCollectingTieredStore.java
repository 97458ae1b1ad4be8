package com.opensensor.querycache.micrometer;

import com.opensensor.querycache.CacheKey;
import com.opensensor.querycache.Tier;
import com.opensensor.querycache.store.StoreHealth;
import com.opensensor.querycache.store.TieredStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Optional;
import org.springframework.core.ParameterizedTypeReference;

/**
 * A TieredStore decorator that records latency, hit/miss and error metrics for every operation,
 * tagged with the tier of the key involved. Exceptions from the delegate are counted and
 * rethrown.
 */
public class MetricsCollectingTieredStore implements TieredStore {

    private static final String METRIC_LATENCY = "querycache.latency";
    private static final String METRIC_OPERATIONS = "querycache.operations.total";
    private static final String METRIC_ERRORS = "querycache.errors.total";
    private static final String METRIC_REJECTED = "querycache.writes.rejected.total";
    private static final String PATTERN_PREFIX = "pattern";

    private final TieredStore delegate;
    private final MeterRegistry meterRegistry;
    private final Tags commonTags;

    /**
     * @param delegate the store to observe
     * @param meterRegistry registry receiving the meters
     * @param backend backend label used as the {@code cache.backend} tag, e.g. "redis"
     */
    public MetricsCollectingTieredStore(TieredStore delegate, MeterRegistry meterRegistry, String backend) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;
        this.commonTags = Tags.of("cache.backend", backend);
    }

    @Override
    public <T> Optional<T> get(CacheKey key, ParameterizedTypeReference<T> typeRef) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String keyPrefix = key.tier().prefix();
        try {
            Optional<T> value = delegate.get(key, typeRef);

            Tag resultTag = value.isPresent() ? Tag.of("result", "hit") : Tag.of("result", "miss");
            Counter.builder(METRIC_OPERATIONS)
                    .tags(commonTags.and(resultTag).and("key.prefix", keyPrefix))
                    .register(meterRegistry)
                    .increment();

            stop(sample, "get", keyPrefix);
            return value;
        } catch (RuntimeException e) {
            recordFailure(sample, "get", keyPrefix, e);
            throw e;
        }
    }

    @Override
    public boolean set(CacheKey key, Object value, Duration ttl) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String keyPrefix = key.tier().prefix();
        try {
            boolean written = delegate.set(key, value, ttl);
            if (!written) {
                Counter.builder(METRIC_REJECTED)
                        .tags(commonTags.and("key.prefix", keyPrefix))
                        .register(meterRegistry)
                        .increment();
            }
            stop(sample, "set", keyPrefix);
            return written;
        } catch (RuntimeException e) {
            recordFailure(sample, "set", keyPrefix, e);
            throw e;
        }
    }

    @Override
    public boolean delete(CacheKey key) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String keyPrefix = key.tier().prefix();
        try {
            boolean deleted = delegate.delete(key);
            stop(sample, "delete", keyPrefix);
            return deleted;
        } catch (RuntimeException e) {
            recordFailure(sample, "delete", keyPrefix, e);
            throw e;
        }
    }

    @Override
    public long deleteByPattern(String pattern) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Tier tier = Tier.ofKey(pattern);
        String keyPrefix = tier != null ? tier.prefix() : PATTERN_PREFIX;
        try {
            long deleted = delegate.deleteByPattern(pattern);
            stop(sample, "delete_by_pattern", keyPrefix);
            return deleted;
        } catch (RuntimeException e) {
            recordFailure(sample, "delete_by_pattern", keyPrefix, e);
            throw e;
        }
    }

    @Override
    public StoreHealth healthCheck() {
        return delegate.healthCheck();
    }

    private void stop(Timer.Sample sample, String operation, String keyPrefix) {
        sample.stop(
                Timer.builder(METRIC_LATENCY)
                        .tags(commonTags)
                        .tags("operation", operation, "key.prefix", keyPrefix)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(meterRegistry));
    }

    private void recordFailure(Timer.Sample sample, String operation, String keyPrefix, Exception e) {
        stop(sample, operation, keyPrefix);
        Counter.builder(METRIC_ERRORS)
                .tags(commonTags)
                .tags(
                        "operation",
                        operation,
                        "key.prefix",
                        keyPrefix,
                        "exception.type",
                        e.getClass().getSimpleName())
                .register(meterRegistry)
                .increment();
    }
}
