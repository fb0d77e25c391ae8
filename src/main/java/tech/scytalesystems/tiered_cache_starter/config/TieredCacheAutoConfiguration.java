package tech.scytalesystems.tiered_cache_starter.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.cache.CacheAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import tech.scytalesystems.tiered_cache_starter.aspect.InvalidateTagsAspect;
import tech.scytalesystems.tiered_cache_starter.cache.L1Store;
import tech.scytalesystems.tiered_cache_starter.cache.L2Store;
import tech.scytalesystems.tiered_cache_starter.cache.RedisL2Store;
import tech.scytalesystems.tiered_cache_starter.cache.ResilientL2Store;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.eviction.EvictionManager;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationBroker;
import tech.scytalesystems.tiered_cache_starter.metrics.CacheAlertListener;
import tech.scytalesystems.tiered_cache_starter.metrics.MetricsCollector;
import tech.scytalesystems.tiered_cache_starter.spring.TieredCacheManager;
import tech.scytalesystems.tiered_cache_starter.sync.InvalidationSyncService;
import tech.scytalesystems.tiered_cache_starter.warmup.WarmupScheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1515h
 * <p>Spring Boot AutoConfiguration that:
 * <p>- Builds the L1 store, the Redis L2 store (behind retry + timeout) and the coordinator over both
 * <p>- Starts the L1 expiry sweep and metrics collection with the coordinator, stops them on shutdown
 * <p>- Registers the invalidation broker, warmup scheduler and a Spring {@link CacheManager}
 * <p>- Broadcasts invalidations to other instances over Redis Pub/Sub (app.cache.sync.enabled)
 * <p>- Sets up {@code @InvalidateTags} interception via AOP
 * <p>This configuration is activated when:
 * <p>1. Redis classes are on the classpath
 * <p>2. RedisConnectionFactory bean exists
 * <p>3. app.cache.enabled=true (default)
 */
@AutoConfiguration(after = RedisAutoConfiguration.class, before = CacheAutoConfiguration.class)
@ConditionalOnClass(RedisConnectionFactory.class)
@ConditionalOnBean(RedisConnectionFactory.class)
@ConditionalOnProperty(prefix = "app.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TieredCacheProperties.class)
@SuppressWarnings("unused")
public class TieredCacheAutoConfiguration {
    /**
     * Values are written as JSON with type information so they read back as the type that was written.
     */
    @Bean
    @ConditionalOnMissingBean(name = "tieredCacheRedisTemplate")
    public RedisTemplate<String, Object> tieredCacheRedisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(factory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(valueSerializer());
        template.afterPropertiesSet();
        return template;
    }

    /**
     * Type ids go on every value, final types included: records and Longs would otherwise come back
     * as a failed read and an Integer. Java time types are written as ISO strings.
     */
    @SuppressWarnings("deprecation")
    static GenericJackson2JsonRedisSerializer valueSerializer() {
        ObjectMapper mapper = new JacksonConfig().objectMapper();
        mapper.activateDefaultTyping(
                BasicPolymorphicTypeValidator.builder().allowIfSubType(Object.class).build(),
                ObjectMapper.DefaultTyping.EVERYTHING,
                JsonTypeInfo.As.PROPERTY);

        return new GenericJackson2JsonRedisSerializer(mapper);
    }

    /**
     * Tag sets and Pub/Sub messages are plain strings.
     */
    @Bean
    @ConditionalOnMissingBean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }

    @Bean
    @ConditionalOnMissingBean
    public L1Store l1Store(TieredCacheProperties props) {
        return new L1Store(props.getL1().getMaxSize(), Clock.systemUTC());
    }

    /**
     * Redis store wrapped with retry and a per-attempt timeout. The pool is shut down with the context.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(L2Store.class)
    public ResilientL2Store l2Store(RedisTemplate<String, Object> tieredCacheRedisTemplate,
                                    StringRedisTemplate stringRedisTemplate,
                                    TieredCacheProperties props) {
        TieredCacheProperties.L2 l2 = props.getL2();
        RedisL2Store redis = new RedisL2Store(tieredCacheRedisTemplate, stringRedisTemplate, l2.getKeyPrefix());

        return new ResilientL2Store(redis,
                l2.getMaxRetries(),
                Duration.ofMillis(l2.getRetryDelayMs()),
                Duration.ofMillis(l2.getTimeoutMs()),
                l2.getPoolSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsCollector metricsCollector(TieredCacheProperties props, ObjectProvider<CacheAlertListener> alertListeners) {
        TieredCacheProperties.Metrics metrics = props.getMetrics();
        MetricsCollector collector = new MetricsCollector(Clock.systemUTC(),
                metrics.getWindowSize(),
                metrics.getL1HitRateThreshold(),
                metrics.getResponseTimeThresholdMs());

        alertListeners.orderedStream().forEach(collector::addAlertListener);
        return collector;
    }

    @Bean
    @ConditionalOnMissingBean
    public EvictionManager evictionManager(L1Store l1Store, TieredCacheProperties props) {
        return new EvictionManager(l1Store, Duration.ofSeconds(props.getL1().getSweepIntervalSeconds()));
    }

    /**
     * Starting the coordinator starts the expiry sweep and metrics collection.
     */
    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    public TieredCacheCoordinator tieredCacheCoordinator(L1Store l1Store,
                                                         L2Store l2Store,
                                                         MetricsCollector metricsCollector,
                                                         EvictionManager evictionManager,
                                                         TieredCacheProperties props) {
        return new TieredCacheCoordinator(l1Store,
                l2Store,
                metricsCollector,
                evictionManager,
                new JacksonConfig().objectMapper(),
                Clock.systemUTC(),
                props.getL1().getDefaultTtlSeconds(),
                props.getL2().getDefaultTtlSeconds(),
                Duration.ofSeconds(props.getMetrics().getCollectIntervalSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean
    public InvalidationBroker invalidationBroker(TieredCacheCoordinator coordinator) {
        return new InvalidationBroker(coordinator);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public WarmupScheduler warmupScheduler(TieredCacheCoordinator coordinator, TieredCacheProperties props) {
        return new WarmupScheduler(coordinator, props.getWarmup().getBatchSize(), props.getWarmup().getParallelism());
    }

    /**
     * Backs {@code @Cacheable}/{@code @CacheEvict}. Entries use the L2 default TTL.
     */
    @Bean
    @ConditionalOnMissingBean(CacheManager.class)
    public TieredCacheManager cacheManager(TieredCacheCoordinator coordinator, InvalidationBroker broker, TieredCacheProperties props) {
        return new TieredCacheManager(coordinator, broker, props.getL2().getDefaultTtlSeconds());
    }

    /**
     * Note: Requires spring-boot-starter-aop (or @EnableAspectJAutoProxy) in the application.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
    public InvalidateTagsAspect invalidateTagsAspect(InvalidationBroker broker) {
        return new InvalidateTagsAspect(broker);
    }

    /**
     * Cross-instance L1 invalidation. Disabled with app.cache.sync.enabled=false, in which case
     * deletes stay local to this instance.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "app.cache.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SyncConfiguration {
        @Bean(destroyMethod = "destroy")
        @ConditionalOnMissingBean
        public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory factory) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(factory);

            return container;
        }

        /**
         * Subscribes on construction and becomes the coordinator's remote publisher.
         */
        @Bean
        @ConditionalOnMissingBean
        public InvalidationSyncService invalidationSyncService(StringRedisTemplate stringRedisTemplate,
                                                               TieredCacheCoordinator coordinator,
                                                               RedisMessageListenerContainer container,
                                                               TieredCacheProperties props) {
            InvalidationSyncService service = new InvalidationSyncService(stringRedisTemplate, coordinator, container, props.getSync());
            coordinator.setRemotePublisher(service);

            return service;
        }
    }
}
