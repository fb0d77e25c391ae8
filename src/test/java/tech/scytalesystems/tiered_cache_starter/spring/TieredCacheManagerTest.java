package tech.scytalesystems.tiered_cache_starter.spring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cache.Cache;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationBroker;

import java.util.Collection;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1810h
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TieredCacheManager Tests")
class TieredCacheManagerTest {

    @Mock
    private TieredCacheCoordinator coordinator;

    @Mock
    private InvalidationBroker broker;

    private TieredCacheManager cacheManager;

    @BeforeEach
    void setUp() {
        cacheManager = new TieredCacheManager(coordinator, broker, 600);
    }

    @Test
    @DisplayName("Should return TieredCache instance")
    void testGetCache() {
        Cache cache = cacheManager.getCache("test");

        assertNotNull(cache);
        assertInstanceOf(TieredCache.class, cache);
        assertEquals("test", cache.getName());
        assertEquals(600, ((TieredCache) cache).ttlSeconds());
        assertSame(coordinator, cache.getNativeCache());
    }

    @Test
    @DisplayName("Should return same cache instance for same name")
    void testCacheInstanceConsistency() {
        assertSame(cacheManager.getCache("test"), cacheManager.getCache("test"));
        assertNotSame(cacheManager.getCache("test"), cacheManager.getCache("other"));
    }

    @Test
    @DisplayName("Should list caches that have been requested")
    void testGetCacheNames() {
        assertTrue(cacheManager.getCacheNames().isEmpty());

        cacheManager.getCache("users");
        cacheManager.getCache("products");

        Collection<String> names = cacheManager.getCacheNames();

        assertEquals(2, names.size());
        assertTrue(names.contains("users"));
        assertTrue(names.contains("products"));
    }
}
