package tech.scytalesystems.tiered_cache_starter.eviction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tech.scytalesystems.tiered_cache_starter.cache.L1Store;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1150h
 * <p>Runs the periodic L1 expiry sweep.
 * <p>Lazy expiry on read only catches keys that are read again; write-once keys would sit in L1
 * until LRU pressure pushed them out. The sweep removes them on a fixed interval (default 60s)
 * through {@link L1Store#sweepExpired()}, which takes the same lock as foreground access.
 * <p>LRU eviction is not scheduled here: {@link L1Store#set} performs it synchronously when a
 * new key arrives at capacity.
 */
public class EvictionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EvictionManager.class);

    private final L1Store store;
    private final Duration sweepInterval;
    private ScheduledExecutorService scheduler;

    public EvictionManager(L1Store store, Duration sweepInterval) {
        if (sweepInterval.isZero() || sweepInterval.isNegative())
            throw new IllegalArgumentException("sweepInterval must be positive, got " + sweepInterval);

        this.store = store;
        this.sweepInterval = sweepInterval;
    }

    public synchronized void start() {
        if (scheduler != null) return;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tiered-cache-sweep-");
        threadFactory.setDaemon(true);
        scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
        scheduler.scheduleWithFixedDelay(this::sweepSafely, sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("L1 expiry sweep started - interval: {}", sweepInterval);
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return number of expired entries removed
     */
    public int sweep() {
        int removed = store.sweepExpired();

        if (removed > 0) log.debug("L1 sweep removed {} expired entries, {} remaining", removed, store.size());

        return removed;
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;

        scheduler.shutdownNow();
        scheduler = null;
        log.info("L1 expiry sweep stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void sweepSafely() {
        // An exception escaping here would cancel the schedule
        try {
            sweep();
        } catch (Exception e) {
            log.error("L1 expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
