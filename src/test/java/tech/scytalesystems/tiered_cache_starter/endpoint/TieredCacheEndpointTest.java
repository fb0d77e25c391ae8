package tech.scytalesystems.tiered_cache_starter.endpoint;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.scytalesystems.tiered_cache_starter.cache.L1Store;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.config.JacksonConfig;
import tech.scytalesystems.tiered_cache_starter.config.TieredCacheProperties;
import tech.scytalesystems.tiered_cache_starter.eviction.EvictionManager;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationBroker;
import tech.scytalesystems.tiered_cache_starter.metrics.MetricsCollector;
import tech.scytalesystems.tiered_cache_starter.support.InMemoryL2Store;
import tech.scytalesystems.tiered_cache_starter.support.MutableClock;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1825h
 */
@DisplayName("TieredCacheEndpoint Tests")
class TieredCacheEndpointTest {

    private InMemoryL2Store l2;
    private TieredCacheCoordinator coordinator;
    private TieredCacheEndpoint endpoint;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        L1Store l1 = new L1Store(50, clock);
        l2 = new InMemoryL2Store(clock);
        coordinator = new TieredCacheCoordinator(l1, l2,
                new MetricsCollector(clock, 10, 0.7, 100),
                new EvictionManager(l1, Duration.ofSeconds(60)),
                new JacksonConfig().objectMapper(),
                clock, 300, 1800, Duration.ofSeconds(60));

        endpoint = new TieredCacheEndpoint(coordinator, new InvalidationBroker(coordinator), new TieredCacheProperties());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should report configuration, L1 size, metrics and L2 health")
    void testInfo() {
        coordinator.set("k1", "v1", 60);
        coordinator.get("k1");
        coordinator.get("missing");

        Map<String, Object> info = endpoint.info();

        Map<String, Object> config = (Map<String, Object>) info.get("configuration");
        assertEquals(1000, config.get("l1MaxSize"));
        assertEquals("cache:", config.get("l2KeyPrefix"));

        Map<String, Object> l1 = (Map<String, Object>) info.get("l1");
        assertEquals(1, l1.get("size"));
        assertEquals(50, l1.get("maxSize"));

        Map<String, Object> l2Info = (Map<String, Object>) info.get("l2");
        assertEquals("UP", l2Info.get("status"));
        assertEquals(1L, l2Info.get("latencyMs"));

        Map<String, Object> metrics = (Map<String, Object>) info.get("metrics");
        assertEquals(2L, metrics.get("totalRequests"));
        Map<String, Object> l1Metrics = (Map<String, Object>) metrics.get("l1");
        assertEquals(1L, l1Metrics.get("hits"));
        assertEquals(1L, l1Metrics.get("misses"));
        assertTrue(metrics.containsKey("l2"));

        assertEquals(0, info.get("historySize"));
        assertTrue(info.containsKey("hitRateTrend"));
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should report L2 as down when it cannot be reached")
    void testInfoWithL2Down() {
        l2.setUnavailable(true);

        Map<String, Object> l2Info = (Map<String, Object>) endpoint.info().get("l2");

        assertEquals("DOWN", l2Info.get("status"));
        assertNotNull(l2Info.get("error"));
    }

    @Test
    @DisplayName("Should evict a single key from both tiers")
    void testEvict() {
        coordinator.set("k1", "v1", 60);

        Map<String, Object> result = endpoint.evict("k1");

        assertEquals(true, result.get("success"));
        assertEquals("k1", result.get("key"));
        assertNotNull(result.get("evictedAt"));
        assertNull(coordinator.get("k1"));
        assertFalse(l2.containsKey("k1"));
    }

    @Test
    @DisplayName("Should report failure when L2 rejects the eviction")
    void testEvictFailure() {
        coordinator.set("k1", "v1", 60);
        l2.setUnavailable(true);

        Map<String, Object> result = endpoint.evict("k1");

        assertEquals(false, result.get("success"));
        assertEquals(0, coordinator.l1Size());
    }

    @Test
    @DisplayName("Should invalidate by tags")
    void testInvalidateTags() {
        coordinator.set("p1", "a", 60, Set.of("products"));
        coordinator.set("p2", "b", 60, Set.of("products"));
        coordinator.set("u1", "c", 60, Set.of("users"));

        Map<String, Object> result = endpoint.invalidateTags(List.of("products"));

        assertEquals(true, result.get("success"));
        assertEquals(2, result.get("invalidatedKeys"));
        assertEquals(Set.of(), result.get("failedKeys"));
        assertNull(coordinator.get("p1"));
        assertEquals("c", coordinator.get("u1"));
    }

    @Test
    @DisplayName("Should reject an empty tag list")
    void testInvalidateNoTags() {
        Map<String, Object> result = endpoint.invalidateTags(List.of());

        assertEquals(false, result.get("success"));
        assertEquals("No tags provided for invalidation", result.get("error"));
    }
}
