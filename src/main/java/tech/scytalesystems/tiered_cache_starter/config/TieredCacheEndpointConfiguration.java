package tech.scytalesystems.tiered_cache_starter.config;

import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.endpoint.TieredCacheEndpoint;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationBroker;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1525h
 * Auto-configuration for the tiered-cache Spring Boot Actuator endpoint.
 * <p>
 * Registered when Actuator is on the classpath, the tiered cache itself is configured, the endpoint
 * is enabled and exposed, and no custom {@link TieredCacheEndpoint} bean is defined.
 */
@AutoConfiguration(after = TieredCacheAutoConfiguration.class)
@ConditionalOnClass(name = {
        "org.springframework.boot.actuate.endpoint.annotation.Endpoint",
        "org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint"
})
@ConditionalOnBean(TieredCacheCoordinator.class)
@SuppressWarnings("unused")
public class TieredCacheEndpointConfiguration {
    /**
     * The endpoint will be registered at /actuator/tiered-cache
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnAvailableEndpoint
    public TieredCacheEndpoint tieredCacheEndpoint(TieredCacheCoordinator coordinator,
                                                   InvalidationBroker broker,
                                                   TieredCacheProperties properties) {
        return new TieredCacheEndpoint(coordinator, broker, properties);
    }
}
