package com.opensensor.querycache.starter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opensensor.querycache.KeyCodec;
import com.opensensor.querycache.SizeGuard;
import com.opensensor.querycache.TierPolicy;
import com.opensensor.querycache.caffeine.CaffeineTieredStore;
import com.opensensor.querycache.invalidation.Invalidator;
import com.opensensor.querycache.lookup.CacheAwareAggregation;
import com.opensensor.querycache.lookup.CacheAwareChunkLookup;
import com.opensensor.querycache.lookup.CacheAwareLookup;
import com.opensensor.querycache.lookup.InFlightLoads;
import com.opensensor.querycache.lookup.ReadThroughCache;
import com.opensensor.querycache.micrometer.MetricsCollectingTieredStore;
import com.opensensor.querycache.redis.RedisTieredStore;
import com.opensensor.querycache.resilience.CircuitBreakerTieredStore;
import com.opensensor.querycache.resilience.DegradingTieredStore;
import com.opensensor.querycache.serializer.CacheSerializer;
import com.opensensor.querycache.serializer.JacksonCacheSerializer;
import com.opensensor.querycache.source.DeviceResolver;
import com.opensensor.querycache.source.PipelineSource;
import com.opensensor.querycache.starter.actuator.QueryCacheEndpoint;
import com.opensensor.querycache.store.NoOpTieredStore;
import com.opensensor.querycache.store.TieredStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Spring Boot auto-configuration for the OpenSensor query cache.
 *
 * <p><strong>Store stack:</strong> the backend selected by {@code querycache.backend} is wrapped,
 * innermost first, by metrics collection (when a {@link MeterRegistry} exists), a Resilience4j
 * circuit breaker (unless disabled) and the degradation layer. The result is exposed as the
 * {@code tieredStore} bean. With {@code querycache.enabled=false}, or when the Redis backend is
 * selected but no {@link RedisConnectionFactory} exists, a {@link NoOpTieredStore} is used
 * instead and every lookup goes to the source.</p>
 *
 * <p><strong>Call-sites:</strong> {@link CacheAwareLookup} and {@link CacheAwareAggregation} are
 * created only when the application provides a {@link DeviceResolver} or a
 * {@link PipelineSource} bean respectively. {@link CacheAwareChunkLookup} and
 * {@link Invalidator} are always available.</p>
 *
 * @see QueryCacheProperties
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(QueryCacheProperties.class)
public class QueryCacheAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(QueryCacheAutoConfiguration.class);

    private static final String BACKEND_BEAN = "queryCacheBackend";

    @Bean
    @ConditionalOnMissingBean
    public KeyCodec keyCodec() {
        return new KeyCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public TierPolicy tierPolicy(QueryCacheProperties properties) {
        return properties.toTierPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public SizeGuard sizeGuard(QueryCacheProperties properties) {
        return new SizeGuard(properties.getMaxEntrySize().toBytes());
    }

    @Bean("queryCacheObjectMapper")
    @ConditionalOnMissingBean(name = "queryCacheObjectMapper")
    public ObjectMapper queryCacheObjectMapper() {
        return JacksonCacheSerializer.defaultObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheSerializer cacheSerializer(@Qualifier("queryCacheObjectMapper") ObjectMapper objectMapper) {
        log.info("No custom CacheSerializer bean found. Creating default JacksonCacheSerializer.");
        return new JacksonCacheSerializer(objectMapper);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RedisTemplate.class)
    @ConditionalOnProperty(name = "querycache.backend", havingValue = "redis", matchIfMissing = true)
    protected static class RedisStoreConfiguration {

        @Bean
        @ConditionalOnClass(name = "io.lettuce.core.RedisClient")
        public LettuceClientConfigurationBuilderCustomizer queryCacheCommandTimeoutCustomizer(
                QueryCacheProperties properties) {
            return builder -> builder.commandTimeout(properties.getRedis().getCommandTimeout());
        }

        @Bean("queryCacheRedisTemplate")
        @ConditionalOnBean(RedisConnectionFactory.class)
        @ConditionalOnMissingBean(name = "queryCacheRedisTemplate")
        public RedisTemplate<String, byte[]> queryCacheRedisTemplate(RedisConnectionFactory connectionFactory) {
            RedisTemplate<String, byte[]> template = new RedisTemplate<>();
            template.setConnectionFactory(connectionFactory);
            template.setKeySerializer(new StringRedisSerializer());
            template.setValueSerializer(RedisSerializer.byteArray());
            template.afterPropertiesSet();
            return template;
        }

        @Bean(BACKEND_BEAN)
        @ConditionalOnBean(RedisConnectionFactory.class)
        @ConditionalOnProperty(name = "querycache.enabled", havingValue = "true", matchIfMissing = true)
        public TieredStore redisBackend(
                @Qualifier("queryCacheRedisTemplate") RedisTemplate<String, byte[]> redisTemplate,
                QueryCacheProperties properties,
                CacheSerializer serializer,
                SizeGuard sizeGuard) {
            return new RedisTieredStore(
                    redisTemplate,
                    properties.getNamespace(),
                    serializer,
                    sizeGuard,
                    properties.getRedis().getScanBatchSize());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "querycache.backend", havingValue = "caffeine")
    protected static class CaffeineStoreConfiguration {

        @Bean(BACKEND_BEAN)
        @ConditionalOnProperty(name = "querycache.enabled", havingValue = "true", matchIfMissing = true)
        public TieredStore caffeineBackend(
                QueryCacheProperties properties, CacheSerializer serializer, SizeGuard sizeGuard) {
            return new CaffeineTieredStore(
                    properties.getNamespace(),
                    serializer,
                    sizeGuard,
                    properties.getCaffeine().getMaximumSize());
        }
    }

    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "tieredStore")
    public TieredStore tieredStore(
            @Qualifier(BACKEND_BEAN) Optional<TieredStore> backend,
            QueryCacheProperties properties,
            Optional<MeterRegistry> meterRegistry,
            Optional<CircuitBreakerRegistry> circuitBreakerRegistry) {
        if (!properties.isEnabled()) {
            log.info("Query cache is disabled. All lookups go to the source.");
            return new NoOpTieredStore();
        }
        if (backend.isEmpty()) {
            log.warn("Query cache backend '{}' is not available. All lookups go to the source.",
                    properties.getBackend().name().toLowerCase(Locale.ROOT));
            return new NoOpTieredStore();
        }

        TieredStore store = backend.get();
        String backendLabel = properties.getBackend().name().toLowerCase(Locale.ROOT);

        if (meterRegistry.isPresent()) {
            log.info("MeterRegistry found. Enabling metrics for the {} query cache.", backendLabel);
            store = new MetricsCollectingTieredStore(store, meterRegistry.get(), backendLabel);
        } else {
            log.warn(
                    "MeterRegistry not found. Query cache metrics are disabled. "
                            + "Add 'spring-boot-starter-actuator' to enable them.");
        }

        QueryCacheProperties.CircuitBreakerProperties cbProps = properties.getCircuitBreaker();
        if (cbProps.isEnabled()) {
            CircuitBreakerConfig config =
                    CircuitBreakerTieredStore.configBuilder()
                            .failureRateThreshold(cbProps.getFailureRateThreshold())
                            .slowCallRateThreshold(cbProps.getSlowCallRateThreshold())
                            .slowCallDurationThreshold(cbProps.getSlowCallDurationThreshold())
                            .permittedNumberOfCallsInHalfOpenState(cbProps.getPermittedNumberOfCallsInHalfOpenState())
                            .waitDurationInOpenState(cbProps.getWaitDurationInOpenState())
                            .build();
            CircuitBreaker circuitBreaker = circuitBreakerRegistry
                    .map(registry -> registry.circuitBreaker("queryCache", config))
                    .orElseGet(() -> CircuitBreaker.of("queryCache", config));
            log.info("Circuit breaker enabled for the {} query cache.", backendLabel);
            store = new CircuitBreakerTieredStore(store, circuitBreaker);
        }

        return new DegradingTieredStore(store);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "querycache.dedupe-in-flight", havingValue = "true", matchIfMissing = true)
    public InFlightLoads inFlightLoads() {
        return new InFlightLoads();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReadThroughCache readThroughCache(TieredStore tieredStore, Optional<InFlightLoads> inFlightLoads) {
        return new ReadThroughCache(tieredStore, inFlightLoads.orElse(null));
    }

    @Bean
    @ConditionalOnMissingBean
    public Invalidator invalidator(TieredStore tieredStore, KeyCodec keyCodec) {
        return new Invalidator(tieredStore, keyCodec);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheAwareChunkLookup cacheAwareChunkLookup(
            ReadThroughCache readThroughCache, KeyCodec keyCodec, TierPolicy tierPolicy) {
        return new CacheAwareChunkLookup(readThroughCache, keyCodec, tierPolicy);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DeviceResolver.class)
    public CacheAwareLookup cacheAwareLookup(
            ReadThroughCache readThroughCache,
            KeyCodec keyCodec,
            TierPolicy tierPolicy,
            DeviceResolver deviceResolver,
            Optional<Clock> clock) {
        return new CacheAwareLookup(
                readThroughCache, keyCodec, tierPolicy, deviceResolver, clock.orElseGet(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(PipelineSource.class)
    public CacheAwareAggregation cacheAwareAggregation(
            ReadThroughCache readThroughCache,
            KeyCodec keyCodec,
            TierPolicy tierPolicy,
            PipelineSource pipelineSource) {
        return new CacheAwareAggregation(readThroughCache, keyCodec, tierPolicy, pipelineSource);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.springframework.boot.actuate.endpoint.annotation.Endpoint")
    public QueryCacheEndpoint queryCacheEndpoint(TieredStore tieredStore) {
        return new QueryCacheEndpoint(tieredStore);
    }
}
