package tech.scytalesystems.tiered_cache_starter.eviction;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.scytalesystems.tiered_cache_starter.cache.CacheEntry;
import tech.scytalesystems.tiered_cache_starter.cache.L1Store;
import tech.scytalesystems.tiered_cache_starter.support.MutableClock;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1650h
 */
@DisplayName("EvictionManager Tests")
class EvictionManagerTest {
    private MutableClock clock;
    private L1Store store;
    private EvictionManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new L1Store(10, clock);
    }

    @AfterEach
    void tearDown() {
        if (manager != null) manager.close();
    }

    @Test
    @DisplayName("Should remove expired entries that are never read again")
    void testSweepRemovesWriteOnceEntries() {
        manager = new EvictionManager(store, Duration.ofSeconds(60));
        store.set("once", new CacheEntry<>("v", 5, Set.of("t"), clock.instant()));
        store.set("fresh", new CacheEntry<>("v", 60, Set.of(), clock.instant()));

        clock.advanceSeconds(10);

        assertEquals(1, manager.sweep());
        assertEquals(1, store.size());
        assertTrue(store.keysWithTag("t").isEmpty());
    }

    @Test
    @DisplayName("Should sweep on its own schedule once started")
    void testScheduledSweep() throws InterruptedException {
        manager = new EvictionManager(store, Duration.ofMillis(20));
        store.set("k", new CacheEntry<>("v", 1, Set.of(), clock.instant()));
        clock.advanceSeconds(2);

        manager.start();

        long deadline = System.currentTimeMillis() + 2_000;
        while (store.size() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Should start once and stop cleanly")
    void testLifecycle() {
        manager = new EvictionManager(store, Duration.ofSeconds(60));
        assertFalse(manager.isRunning());

        manager.start();
        manager.start();
        assertTrue(manager.isRunning());

        manager.close();
        manager.close();
        assertFalse(manager.isRunning());
    }

    @Test
    @DisplayName("Should reject a non-positive interval")
    void testRejectsInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new EvictionManager(store, Duration.ZERO));
    }
}
