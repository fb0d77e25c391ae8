package tech.scytalesystems.tiered_cache_starter.metrics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.scytalesystems.tiered_cache_starter.support.MutableClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1715h
 */
@DisplayName("MetricsCollector Tests")
class MetricsCollectorTest {
    private MutableClock clock;
    private MetricsCollector collector;
    private List<CacheAlert> alerts;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        collector = new MetricsCollector(clock, 3, 0.7, 100);
        alerts = new ArrayList<>();
        collector.addAlertListener(alerts::add);
    }

    @AfterEach
    void tearDown() {
        collector.close();
    }

    private void record(CacheTier tier, int hits, int misses) {
        for (int i = 0; i < hits; i++) collector.recordHit(tier);
        for (int i = 0; i < misses; i++) collector.recordMiss(tier);
    }

    @Test
    @DisplayName("Should compute per-tier and overall hit rates")
    void testHitRates() {
        // 10 requests: 6 served by L1, 3 by L2, 1 missed both
        record(CacheTier.L1, 6, 4);
        record(CacheTier.L2, 3, 1);

        MetricsSnapshot snapshot = collector.collect();

        assertEquals(0.6, snapshot.tier(CacheTier.L1).hitRate(), 1e-9);
        assertEquals(0.75, snapshot.tier(CacheTier.L2).hitRate(), 1e-9);
        assertEquals(10, snapshot.totalRequests());
        assertEquals(0.9, snapshot.overallHitRate(), 1e-9);
    }

    @Test
    @DisplayName("Should reset counters on collect but not on snapshot")
    void testCollectResets() {
        record(CacheTier.L1, 2, 0);
        collector.recordEviction(CacheTier.L1);
        collector.recordError(CacheTier.L2);

        assertEquals(2, collector.snapshot().tier(CacheTier.L1).hits());
        assertEquals(2, collector.snapshot().tier(CacheTier.L1).hits());

        MetricsSnapshot collected = collector.collect();
        assertEquals(1, collected.tier(CacheTier.L1).evictions());
        assertEquals(1, collected.tier(CacheTier.L2).errors());

        assertEquals(0, collector.snapshot().tier(CacheTier.L1).hits());
        assertEquals(0, collector.snapshot().tier(CacheTier.L1).evictions());
    }

    @Test
    @DisplayName("Should average response times in milliseconds")
    void testAverageResponseTime() {
        collector.recordResponseTime(TimeUnit.MILLISECONDS.toNanos(2));
        collector.recordResponseTime(TimeUnit.MILLISECONDS.toNanos(4));

        assertEquals(3.0, collector.collect().averageResponseTimeMs(), 1e-9);
        assertEquals(0.0, collector.snapshot().averageResponseTimeMs(), 1e-9);
    }

    @Test
    @DisplayName("Should keep only the configured number of snapshots")
    void testBoundedWindow() {
        for (int i = 0; i < 5; i++) {
            clock.advanceSeconds(60);
            collector.collect();
        }

        List<MetricsSnapshot> history = collector.history();
        assertEquals(3, history.size());
        assertEquals(clock.instant(), history.get(2).timestamp());
        assertEquals(clock.instant().minusSeconds(120), history.get(0).timestamp());
    }

    @Test
    @DisplayName("Should alert when the L1 hit rate drops below the threshold")
    void testLowHitRateAlert() {
        record(CacheTier.L1, 5, 5);

        collector.collect();

        assertEquals(1, alerts.size());
        CacheAlert alert = alerts.get(0);
        assertEquals(CacheAlert.Type.LOW_L1_HIT_RATE, alert.type());
        assertEquals(0.5, alert.observed(), 1e-9);
        assertEquals(0.7, alert.threshold(), 1e-9);
    }

    @Test
    @DisplayName("Should not alert on an idle interval")
    void testNoAlertWithoutTraffic() {
        collector.collect();

        assertTrue(alerts.isEmpty());
    }

    @Test
    @DisplayName("Should alert when reads are slow")
    void testSlowResponseAlert() {
        record(CacheTier.L1, 10, 0);
        collector.recordResponseTime(TimeUnit.MILLISECONDS.toNanos(250));

        collector.collect();

        assertEquals(1, alerts.size());
        assertEquals(CacheAlert.Type.HIGH_RESPONSE_TIME, alerts.get(0).type());
    }

    @Test
    @DisplayName("Should keep alerting other listeners when one fails")
    void testListenerFailureIsolated() {
        List<CacheAlert> others = new ArrayList<>();
        collector = new MetricsCollector(clock, 3, 0.7, 100);
        collector.addAlertListener(alert -> {
            throw new IllegalStateException("pager down");
        });
        collector.addAlertListener(others::add);

        record(CacheTier.L1, 0, 3);

        assertDoesNotThrow(collector::collect);
        assertEquals(1, others.size());
    }

    @Test
    @DisplayName("Should report the hit-rate trend across intervals with traffic")
    void testHitRateTrend() {
        assertEquals(0.0, collector.hitRateTrend(), 1e-9);

        record(CacheTier.L1, 2, 8);
        record(CacheTier.L2, 0, 8);
        collector.collect();

        collector.collect();

        record(CacheTier.L1, 8, 2);
        record(CacheTier.L2, 0, 2);
        collector.collect();

        assertEquals(0.6, collector.hitRateTrend(), 1e-9);
    }

    @Test
    @DisplayName("Should start and stop the collection schedule")
    void testLifecycle() throws InterruptedException {
        collector.start(Duration.ofMillis(20));
        assertTrue(collector.isRunning());

        long deadline = System.currentTimeMillis() + 2_000;
        while (collector.history().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(collector.history().isEmpty());

        collector.close();
        assertFalse(collector.isRunning());
    }
}
