package tech.scytalesystems.tiered_cache_starter.endpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;
import tech.scytalesystems.tiered_cache_starter.exception.TieredCacheException;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationBroker;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationResult;
import tech.scytalesystems.tiered_cache_starter.metrics.CacheTier;
import tech.scytalesystems.tiered_cache_starter.metrics.MetricsCollector;
import tech.scytalesystems.tiered_cache_starter.metrics.MetricsSnapshot;
import tech.scytalesystems.tiered_cache_starter.metrics.TierStats;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1505h
 * <p>
 * Spring Boot Actuator endpoint for inspecting and invalidating the tiered cache.
 * <p>
 * Access via: /actuator/tiered-cache
 * <p>
 * - GET    /actuator/tiered-cache          configuration, L1 size, live metrics, L2 health
 * <br>- DELETE /actuator/tiered-cache/{key}    removes one key from both tiers and every instance's L1
 * <br>- POST   /actuator/tiered-cache          body {"tags": ["a", "b"]}, tag invalidation
 * <p>
 * Configuration:
 * management.endpoints.web.exposure.include=tiered-cache
 */
@Endpoint(id = "tiered-cache")
public class TieredCacheEndpoint {
    private static final Logger log = LoggerFactory.getLogger(TieredCacheEndpoint.class);

    private final TieredCacheCoordinator coordinator;
    private final InvalidationBroker broker;
    private final TieredCacheProperties properties;

    public TieredCacheEndpoint(TieredCacheCoordinator coordinator, InvalidationBroker broker, TieredCacheProperties properties) {
        this.coordinator = coordinator;
        this.broker = broker;
        this.properties = properties;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> result = new LinkedHashMap<>();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("l1MaxSize", properties.getL1().getMaxSize());
        config.put("l1DefaultTtlSeconds", properties.getL1().getDefaultTtlSeconds());
        config.put("l2DefaultTtlSeconds", properties.getL2().getDefaultTtlSeconds());
        config.put("l2KeyPrefix", properties.getL2().getKeyPrefix());
        config.put("syncEnabled", properties.getSync().isEnabled());
        result.put("configuration", config);

        Map<String, Object> l1 = new LinkedHashMap<>();
        l1.put("size", coordinator.l1Size());
        l1.put("maxSize", coordinator.getL1Store().getMaxSize());
        result.put("l1", l1);

        result.put("l2", l2Health());

        MetricsCollector metrics = coordinator.getMetrics();
        result.put("metrics", describe(metrics.snapshot()));
        result.put("historySize", metrics.history().size());
        result.put("hitRateTrend", metrics.hitRateTrend());

        return result;
    }

    @DeleteOperation
    public Map<String, Object> evict(@Selector String key) {
        Map<String, Object> result = new LinkedHashMap<>();

        try {
            InvalidationResult outcome = broker.invalidate(key);

            result.put("success", outcome.isComplete());
            result.put("key", key);
            result.put("evictedAt", Instant.now());

            log.info("Manual eviction triggered via endpoint: key={}, complete={}", key, outcome.isComplete());
        } catch (Exception e) {
            log.error("Failed to evict via endpoint: key={}", key, e);
            result.put("success", false);
            result.put("error", e.getMessage());
        }

        return result;
    }

    @WriteOperation
    public Map<String, Object> invalidateTags(List<String> tags) {
        Map<String, Object> result = new LinkedHashMap<>();

        if (tags == null || tags.isEmpty()) {
            result.put("success", false);
            result.put("error", "No tags provided for invalidation");
            return result;
        }

        try {
            InvalidationResult outcome = broker.invalidateByTags(tags);

            result.put("success", outcome.isComplete());
            result.put("tags", tags);
            result.put("invalidatedKeys", outcome.invalidatedKeys().size());
            result.put("failedKeys", outcome.failedKeys());
            result.put("failedTags", outcome.failedTags());

            log.info("Manual tag invalidation triggered via endpoint: tags={}, keys={}", tags, outcome.invalidatedKeys().size());
        } catch (Exception e) {
            log.error("Failed to invalidate tags via endpoint: tags={}", tags, e);
            result.put("success", false);
            result.put("error", e.getMessage());
        }

        return result;
    }

    private Map<String, Object> l2Health() {
        Map<String, Object> l2 = new LinkedHashMap<>();

        try {
            Duration latency = coordinator.getL2Store().ping();
            l2.put("status", "UP");
            l2.put("latencyMs", latency.toMillis());
        } catch (TieredCacheException e) {
            l2.put("status", "DOWN");
            l2.put("error", e.getMessage());
        }

        return l2;
    }

    private static Map<String, Object> describe(MetricsSnapshot snapshot) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("timestamp", snapshot.timestamp());
        metrics.put("totalRequests", snapshot.totalRequests());
        metrics.put("overallHitRate", snapshot.overallHitRate());
        metrics.put("averageResponseTimeMs", snapshot.averageResponseTimeMs());

        for (CacheTier tier : CacheTier.values()) {
            TierStats stats = snapshot.tier(tier);

            Map<String, Object> tierInfo = new LinkedHashMap<>();
            tierInfo.put("hits", stats.hits());
            tierInfo.put("misses", stats.misses());
            tierInfo.put("evictions", stats.evictions());
            tierInfo.put("errors", stats.errors());
            tierInfo.put("hitRate", stats.hitRate());
            metrics.put(tier.name().toLowerCase(), tierInfo);
        }

        return metrics;
    }
}
