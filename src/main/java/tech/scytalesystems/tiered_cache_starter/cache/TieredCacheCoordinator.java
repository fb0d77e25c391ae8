package tech.scytalesystems.tiered_cache_starter.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.scytalesystems.tiered_cache_starter.eviction.EvictionManager;
import tech.scytalesystems.tiered_cache_starter.exception.TieredCacheException;
import tech.scytalesystems.tiered_cache_starter.metrics.CacheTier;
import tech.scytalesystems.tiered_cache_starter.metrics.MetricsCollector;
import tech.scytalesystems.tiered_cache_starter.sync.RemoteInvalidationPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1240h
 * <p>Entry point of the cache: the only component application code talks to.
 *
 * <p>Read strategy: L1 → L2 (backfill L1 on L2 hit) → null. No loader is called on a plain read.
 * <p>Write strategy: write-through, L1 first so this node sees the value immediately, then L2.
 *
 * <p>Store failures never reach the caller: a failed L2 read is a miss, a failed L2 write leaves the
 * value in L1 only (bounded by the short L1 TTL) and is logged at warn.
 *
 * <p>Owns the lifecycle of the expiry sweep and the metrics collection: {@link #start()} launches both,
 * {@link #close()} stops both.
 */
public class TieredCacheCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TieredCacheCoordinator.class);

    private final L1Store l1Store;
    private final L2Store l2Store;
    private final MetricsCollector metrics;
    private final EvictionManager evictionManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long l1DefaultTtlSeconds;
    private final long l2DefaultTtlSeconds;
    private final Duration metricsInterval;

    private final Map<String, CompletableFuture<Object>> inFlightLoads = new ConcurrentHashMap<>();
    private volatile RemoteInvalidationPublisher remotePublisher = RemoteInvalidationPublisher.NO_OP;

    public TieredCacheCoordinator(L1Store l1Store,
                                  L2Store l2Store,
                                  MetricsCollector metrics,
                                  EvictionManager evictionManager,
                                  ObjectMapper objectMapper,
                                  Clock clock,
                                  long l1DefaultTtlSeconds,
                                  long l2DefaultTtlSeconds,
                                  Duration metricsInterval) {
        this.l1Store = l1Store;
        this.l2Store = l2Store;
        this.metrics = metrics;
        this.evictionManager = evictionManager;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.l1DefaultTtlSeconds = l1DefaultTtlSeconds;
        this.l2DefaultTtlSeconds = l2DefaultTtlSeconds;
        this.metricsInterval = metricsInterval;

        this.l1Store.setEvictionListener((key, cause) -> {
            if (cause == EvictionListener.RemovalCause.SIZE) metrics.recordEviction(CacheTier.L1);
        });
    }

    // LIFECYCLE
    public void start() {
        evictionManager.start();
        metrics.start(metricsInterval);

        log.info("TieredCacheCoordinator started - l1MaxSize: {}, l1Ttl: {}s, l2Ttl: {}s",
                l1Store.getMaxSize(), l1DefaultTtlSeconds, l2DefaultTtlSeconds);
    }

    @Override
    public void close() {
        evictionManager.close();
        metrics.close();

        log.info("TieredCacheCoordinator stopped");
    }

    // READS

    /**
     * @return the cached value, or null on a miss in both tiers
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        Objects.requireNonNull(key, "key");
        long start = System.nanoTime();

        try {
            Optional<Object> l1Value = l1Store.get(key);
            if (l1Value.isPresent()) {
                metrics.recordHit(CacheTier.L1);
                log.debug("Cache hit: tier=L1, key={}", key);

                return (T) l1Value.get();
            }
            metrics.recordMiss(CacheTier.L1);

            Object l2Value;
            try {
                l2Value = l2Store.get(key).orElse(null);
            } catch (TieredCacheException e) {
                metrics.recordError(CacheTier.L2);
                metrics.recordMiss(CacheTier.L2);
                log.warn("L2 read failed, treating as miss: key={}, error={}", key, e.getMessage());

                return null;
            }

            if (l2Value == null) {
                metrics.recordMiss(CacheTier.L2);
                log.debug("Cache miss: key={}", key);

                return null;
            }

            metrics.recordHit(CacheTier.L2);
            log.debug("Cache hit: tier=L2, key={} (backfilling L1)", key);

            // L2 does not return tags; L2's index still covers this key for tag invalidation
            l1Store.set(key, new CacheEntry<>(l2Value, l1DefaultTtlSeconds, Set.of(), clock.instant()));

            return (T) l2Value;
        } finally {
            metrics.recordResponseTime(System.nanoTime() - start);
        }
    }

    /**
     * Typed read. A value of another but compatible type (a Long asked for an Integer that was
     * stored, a DTO for a Map) is converted with Jackson. A value that cannot be converted counts
     * as a miss.
     */
    public <T> T get(String key, Class<T> type) {
        Object value = get(key);
        if (value == null || type.isInstance(value)) return type.cast(value);

        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            log.warn("Cached value for key={} is a {} and cannot be converted to {}, treating as miss",
                    key, value.getClass().getSimpleName(), type.getSimpleName());
            return null;
        }
    }

    /**
     * Reads several keys. Only hits appear in the result, in request order.
     */
    public <T> Map<String, T> getAll(Collection<String> keys) {
        Map<String, T> result = new LinkedHashMap<>();

        for (String key : keys) {
            T value = get(key);
            if (value != null) result.put(key, value);
        }

        return result;
    }

    /**
     * True if either tier holds a live value for {@code key}. Does not backfill or touch recency.
     */
    public boolean exists(String key) {
        Instant now = clock.instant();
        if (l1Store.peek(key).filter(entry -> !entry.isExpired(now)).isPresent()) return true;

        try {
            return l2Store.get(key).isPresent();
        } catch (TieredCacheException e) {
            metrics.recordError(CacheTier.L2);
            log.warn("L2 exists check failed: key={}, error={}", key, e.getMessage());
            return false;
        }
    }

    // WRITES
    public <T> void set(String key, T value) {
        set(key, value, l2DefaultTtlSeconds, Set.of());
    }

    public <T> void set(String key, T value, long ttlSeconds) {
        set(key, value, ttlSeconds, Set.of());
    }

    /**
     * Write-through. L1 keeps the entry for {@code min(ttlSeconds, l1.defaultTtlSeconds)}, L2 for
     * {@code ttlSeconds}. A failed L2 write is logged and does not undo the L1 write.
     */
    public <T> void set(String key, T value, long ttlSeconds, Collection<String> tags) {
        Objects.requireNonNull(key, "key");
        if (value == null) throw new IllegalArgumentException("Cannot cache a null value for key: " + key);
        if (ttlSeconds <= 0) throw new IllegalArgumentException("ttlSeconds must be > 0, got " + ttlSeconds);

        Set<String> tagSet = tags == null ? Set.of() : Set.copyOf(tags);

        l1Store.set(key, new CacheEntry<>(value, Math.min(ttlSeconds, l1DefaultTtlSeconds), tagSet, clock.instant()));

        try {
            l2Store.setWithTtl(key, value, ttlSeconds, tagSet);
        } catch (TieredCacheException e) {
            metrics.recordError(CacheTier.L2);
            log.warn("L2 write failed, value kept in L1 only: key={}, error={}", key, e.getMessage());
        }

        log.debug("Cache set: key={}, ttl={}s, tags={}", key, ttlSeconds, tagSet);
    }

    public <T> void setAll(Map<String, T> values, long ttlSeconds) {
        values.forEach((key, value) -> set(key, value, ttlSeconds, Set.of()));
    }

    /**
     * Removes {@code key} from both tiers and asks other instances to drop it from their L1.
     */
    public void delete(String key) {
        Objects.requireNonNull(key, "key");
        deleteLocally(key);
        remotePublisher.publishEviction(Set.of(key));
    }

    /**
     * Removes {@code key} from both tiers of this instance only, then drops it from the L2 tag sets
     * of the tags this instance's L1 knew it by. A key only present in L2 stays listed in its tag
     * sets until they expire or a tag invalidation prunes them.
     *
     * @return false if the L2 delete failed
     */
    public boolean deleteLocally(String key) {
        Set<String> tags = l1Store.peek(key).map(CacheEntry::getTags).orElse(Set.of());

        if (!deleteFromTiers(key)) return false;

        for (String tag : tags) {
            try {
                l2Store.removeFromTagIndex(tag, Set.of(key));
            } catch (TieredCacheException e) {
                metrics.recordError(CacheTier.L2);
                log.warn("Could not prune L2 tag index: tag={}, key={}, error={}", tag, key, e.getMessage());
            }
        }

        return true;
    }

    /**
     * Removes {@code key} from both tiers of this instance, leaving tag sets alone.
     *
     * @return false if the L2 delete failed
     */
    public boolean deleteFromTiers(String key) {
        l1Store.delete(key);

        try {
            l2Store.delete(key);
            log.debug("Cache delete: key={}", key);
            return true;
        } catch (TieredCacheException e) {
            metrics.recordError(CacheTier.L2);
            log.warn("L2 delete failed: key={}, error={}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Drops every L1 entry of this instance. L2 is untouched.
     */
    public void clearLocal() {
        int size = l1Store.size();
        l1Store.clear();

        log.debug("Cleared L1: {} entries dropped", size);
    }

    // LOADERS
    public <T> T refresh(String key, Supplier<T> loader) {
        return refresh(key, loader, l2DefaultTtlSeconds, Set.of());
    }

    /**
     * Calls the loader unconditionally and writes its result through both tiers.
     * A null result removes the key. Loader exceptions propagate: they are the caller's data
     * source failing, not the cache.
     */
    public <T> T refresh(String key, Supplier<T> loader, long ttlSeconds, Collection<String> tags) {
        T value = loader.get();

        if (value == null) {
            delete(key);
            return null;
        }

        set(key, value, ttlSeconds, tags);
        log.debug("Cache refreshed: key={}", key);

        return value;
    }

    public <T> T getOrLoad(String key, Supplier<T> loader) {
        return getOrLoad(key, loader, l2DefaultTtlSeconds, Set.of());
    }

    /**
     * Read-through with a loader. Concurrent callers missing on the same key share one loader call;
     * the others wait for its result or rethrow what it threw.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrLoad(String key, Supplier<T> loader, long ttlSeconds, Collection<String> tags) {
        T cached = get(key);
        if (cached != null) return cached;

        CompletableFuture<Object> load = new CompletableFuture<>();
        CompletableFuture<Object> inFlight = inFlightLoads.putIfAbsent(key, load);

        if (inFlight != null) {
            log.debug("Joining in-flight load: key={}", key);
            try {
                return (T) inFlight.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) throw cause;
                if (e.getCause() instanceof Error error) throw error;
                throw e;
            }
        }

        try {
            T value = loader.get();
            if (value != null) set(key, value, ttlSeconds, tags);

            load.complete(value);
            return value;
        } catch (Throwable e) {
            // waiters must be released whatever the loader throws, Errors included
            load.completeExceptionally(e);
            throw e;
        } finally {
            inFlightLoads.remove(key, load);
        }
    }

    // ACCESSORS
    public void setRemotePublisher(RemoteInvalidationPublisher remotePublisher) {
        this.remotePublisher = remotePublisher != null ? remotePublisher : RemoteInvalidationPublisher.NO_OP;
    }

    public RemoteInvalidationPublisher getRemotePublisher() {
        return remotePublisher;
    }

    public L1Store getL1Store() {
        return l1Store;
    }

    public L2Store getL2Store() {
        return l2Store;
    }

    public MetricsCollector getMetrics() {
        return metrics;
    }

    public int l1Size() {
        return l1Store.size();
    }

    public long getL1DefaultTtlSeconds() {
        return l1DefaultTtlSeconds;
    }

    public long getL2DefaultTtlSeconds() {
        return l2DefaultTtlSeconds;
    }
}
