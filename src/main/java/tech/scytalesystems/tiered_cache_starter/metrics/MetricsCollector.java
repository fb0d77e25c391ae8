package tech.scytalesystems.tiered_cache_starter.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1125h
 * <p>Hit/miss telemetry for both tiers.
 *
 * <p>Recording is lock-free ({@link LongAdder}) so it never slows a cache operation down.
 * {@link #collect()} drains the counters into a {@link MetricsSnapshot}, appends it to a bounded
 * rolling window and checks the alert thresholds. A breach is logged and handed to the registered
 * {@link CacheAlertListener}s; it never blocks or fails cache traffic.
 */
public class MetricsCollector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    private final Clock clock;
    private final int windowSize;
    private final double l1HitRateThreshold;
    private final double responseTimeThresholdMs;

    private final Map<CacheTier, Counters> counters = new EnumMap<>(CacheTier.class);
    private final LongAdder responseTimeNanos = new LongAdder();
    private final LongAdder responseCount = new LongAdder();

    private final Deque<MetricsSnapshot> window = new ArrayDeque<>();
    private final List<CacheAlertListener> alertListeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService scheduler;

    public MetricsCollector(Clock clock, int windowSize, double l1HitRateThreshold, double responseTimeThresholdMs) {
        if (windowSize < 1) throw new IllegalArgumentException("windowSize must be at least 1, got " + windowSize);

        this.clock = clock;
        this.windowSize = windowSize;
        this.l1HitRateThreshold = l1HitRateThreshold;
        this.responseTimeThresholdMs = responseTimeThresholdMs;

        for (CacheTier tier : CacheTier.values()) {
            counters.put(tier, new Counters());
        }
    }

    // RECORDING
    public void recordHit(CacheTier tier) {
        counters.get(tier).hits.increment();
    }

    public void recordMiss(CacheTier tier) {
        counters.get(tier).misses.increment();
    }

    public void recordEviction(CacheTier tier) {
        counters.get(tier).evictions.increment();
    }

    public void recordError(CacheTier tier) {
        counters.get(tier).errors.increment();
    }

    public void recordResponseTime(long nanos) {
        responseTimeNanos.add(nanos);
        responseCount.increment();
    }

    /**
     * Live view of the current interval. Does not reset anything.
     */
    public MetricsSnapshot snapshot() {
        Map<CacheTier, TierStats> tiers = new EnumMap<>(CacheTier.class);
        counters.forEach((tier, c) -> tiers.put(tier, c.read()));

        return new MetricsSnapshot(clock.instant(), tiers, averageMs(responseTimeNanos.sum(), responseCount.sum()));
    }

    /**
     * Closes the current interval: drains the counters, appends the snapshot to the window and
     * evaluates alert thresholds.
     *
     * @return the snapshot of the interval just closed
     */
    public MetricsSnapshot collect() {
        Map<CacheTier, TierStats> tiers = new EnumMap<>(CacheTier.class);
        counters.forEach((tier, c) -> tiers.put(tier, c.drain()));

        MetricsSnapshot snapshot = new MetricsSnapshot(clock.instant(), tiers,
                averageMs(responseTimeNanos.sumThenReset(), responseCount.sumThenReset()));

        synchronized (window) {
            window.addLast(snapshot);
            while (window.size() > windowSize) window.removeFirst();
        }

        log.debug("Collected cache metrics: requests={}, overallHitRate={}, l1HitRate={}, l2HitRate={}, avgResponseMs={}",
                snapshot.totalRequests(), snapshot.overallHitRate(), snapshot.tier(CacheTier.L1).hitRate(),
                snapshot.tier(CacheTier.L2).hitRate(), snapshot.averageResponseTimeMs());

        evaluateThresholds(snapshot);

        return snapshot;
    }

    /**
     * @return collected snapshots, oldest first
     */
    public List<MetricsSnapshot> history() {
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    /**
     * Change in overall hit rate across the window: last interval with traffic minus the first one.
     * Positive means the cache is getting warmer. Zero with fewer than two such intervals.
     */
    public double hitRateTrend() {
        List<MetricsSnapshot> active = new ArrayList<>();
        for (MetricsSnapshot s : history()) {
            if (s.totalRequests() > 0) active.add(s);
        }

        if (active.size() < 2) return 0.0;

        return active.get(active.size() - 1).overallHitRate() - active.get(0).overallHitRate();
    }

    public void addAlertListener(CacheAlertListener listener) {
        alertListeners.add(listener);
    }

    // LIFECYCLE
    public synchronized void start(Duration interval) {
        if (scheduler != null) return;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tiered-cache-metrics-");
        threadFactory.setDaemon(true);
        scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
        scheduler.scheduleAtFixedRate(this::collectSafely, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Metrics collection started - interval: {}, window: {} snapshots", interval, windowSize);
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;

        scheduler.shutdownNow();
        scheduler = null;
        log.info("Metrics collection stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void collectSafely() {
        // An exception escaping here would cancel the schedule
        try {
            collect();
        } catch (Exception e) {
            log.error("Metrics collection failed: {}", e.getMessage(), e);
        }
    }

    private void evaluateThresholds(MetricsSnapshot snapshot) {
        TierStats l1 = snapshot.tier(CacheTier.L1);

        if (l1.requests() > 0 && l1.hitRate() < l1HitRateThreshold) {
            fire(new CacheAlert(CacheAlert.Type.LOW_L1_HIT_RATE, l1.hitRate(), l1HitRateThreshold, snapshot.timestamp(),
                    String.format("L1 hit rate %.2f below threshold %.2f (%d requests)", l1.hitRate(), l1HitRateThreshold, l1.requests())));
        }

        if (snapshot.averageResponseTimeMs() > responseTimeThresholdMs) {
            fire(new CacheAlert(CacheAlert.Type.HIGH_RESPONSE_TIME, snapshot.averageResponseTimeMs(), responseTimeThresholdMs, snapshot.timestamp(),
                    String.format("Average response time %.1fms above threshold %.1fms", snapshot.averageResponseTimeMs(), responseTimeThresholdMs)));
        }
    }

    private void fire(CacheAlert alert) {
        log.warn("Cache alert [{}]: {}", alert.type(), alert.message());

        for (CacheAlertListener listener : alertListeners) {
            try {
                listener.onAlert(alert);
            } catch (Exception e) {
                log.warn("Alert listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private static double averageMs(long totalNanos, long count) {
        return count == 0 ? 0.0 : totalNanos / (double) count / 1_000_000.0;
    }

    private static final class Counters {
        final LongAdder hits = new LongAdder();
        final LongAdder misses = new LongAdder();
        final LongAdder evictions = new LongAdder();
        final LongAdder errors = new LongAdder();

        TierStats read() {
            return new TierStats(hits.sum(), misses.sum(), evictions.sum(), errors.sum());
        }

        TierStats drain() {
            return new TierStats(hits.sumThenReset(), misses.sumThenReset(), evictions.sumThenReset(), errors.sumThenReset());
        }
    }
}
