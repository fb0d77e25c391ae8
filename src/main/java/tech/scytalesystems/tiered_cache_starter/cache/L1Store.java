package tech.scytalesystems.tiered_cache_starter.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.scytalesystems.tiered_cache_starter.exception.CapacityExceededException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0940h
 * <p>Bounded in-process tier with LRU eviction and TTL expiry.
 *
 * <p>Recency is tracked by an access-ordered {@link LinkedHashMap}: every hit and every insert
 * moves the key to the tail, so the head is always the entry with the oldest {@code accessedAt},
 * with ties falling to the one inserted first.
 *
 * <p>Expiry is both lazy ({@link #get} drops a lapsed entry instead of returning it) and active
 * ({@link #sweepExpired}, driven by the eviction manager).
 *
 * <p>A single {@link ReentrantLock} guards the map and the {@link TagIndex}; every method that
 * reads or mutates either takes it, including the background sweep.
 */
public class L1Store {
    private static final Logger log = LoggerFactory.getLogger(L1Store.class);

    private final int maxSize;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<?>> entries;
    private final TagIndex tagIndex = new TagIndex();
    private volatile EvictionListener evictionListener = EvictionListener.NO_OP;

    public L1Store(int maxSize, Clock clock) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);

        this.maxSize = maxSize;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Returns the value if present and not expired. A hit refreshes recency, {@code accessedAt}
     * and {@code accessCount}; an expired entry is removed and reported as a miss.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        Instant now = clock.instant();
        boolean expired = false;

        lock.lock();
        try {
            CacheEntry<?> entry = entries.get(key);
            if (entry == null) return Optional.empty();

            if (entry.isExpired(now)) {
                removeLocked(key);
                expired = true;
            } else {
                entry.recordAccess(now);
                return Optional.of((T) entry.getData());
            }
        } finally {
            lock.unlock();
        }

        if (expired) {
            log.trace("L1 lazy expiry: key={}", key);
            evictionListener.onEviction(key, EvictionListener.RemovalCause.EXPIRED);
        }

        return Optional.empty();
    }

    /**
     * Returns the raw entry without touching recency or access statistics.
     * Expired entries are still reported, callers decide what to do with them.
     */
    public Optional<CacheEntry<?>> peek(String key) {
        lock.lock();
        try {
            // LinkedHashMap.get would reorder an access-ordered map
            for (Map.Entry<String, CacheEntry<?>> e : entries.entrySet()) {
                if (e.getKey().equals(key)) return Optional.of(e.getValue());
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or replaces an entry. Admitting a new key at capacity evicts the LRU entry first;
     * replacing an existing key never evicts.
     */
    public void set(String key, CacheEntry<?> entry) {
        String evicted = null;

        lock.lock();
        try {
            CacheEntry<?> previous = entries.remove(key);
            if (previous != null) {
                tagIndex.remove(key, previous.getTags());
            } else if (entries.size() >= maxSize) {
                evicted = evictOneLocked().orElseThrow(() -> new CapacityExceededException(maxSize));
            }

            entries.put(key, entry);
            tagIndex.add(key, entry.getTags());
        } finally {
            lock.unlock();
        }

        if (evicted != null) {
            log.debug("L1 evicted LRU entry: key={} (admitting key={})", evicted, key);
            evictionListener.onEviction(evicted, EvictionListener.RemovalCause.SIZE);
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            return removeLocked(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public Set<String> keysWithTag(String tag) {
        lock.lock();
        try {
            return tagIndex.keysWithTag(tag);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry whose TTL has lapsed, regardless of how recently it was read.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        List<String> removed = new ArrayList<>();

        lock.lock();
        try {
            Iterator<Map.Entry<String, CacheEntry<?>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry<?>> e = it.next();

                if (e.getValue().isExpired(now)) {
                    it.remove();
                    tagIndex.remove(e.getKey(), e.getValue().getTags());
                    removed.add(e.getKey());
                }
            }
        } finally {
            lock.unlock();
        }

        removed.forEach(key -> evictionListener.onEviction(key, EvictionListener.RemovalCause.EXPIRED));

        return removed.size();
    }

    /**
     * Evicts the least-recently-accessed entry.
     *
     * @return the evicted key, empty when the store is empty
     */
    public Optional<String> evictOneLRU() {
        Optional<String> evicted;

        lock.lock();
        try {
            evicted = evictOneLocked();
        } finally {
            lock.unlock();
        }

        evicted.ifPresent(key -> evictionListener.onEviction(key, EvictionListener.RemovalCause.SIZE));

        return evicted;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            tagIndex.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setEvictionListener(EvictionListener evictionListener) {
        this.evictionListener = evictionListener != null ? evictionListener : EvictionListener.NO_OP;
    }

    private Optional<String> evictOneLocked() {
        Iterator<Map.Entry<String, CacheEntry<?>>> it = entries.entrySet().iterator();
        if (!it.hasNext()) return Optional.empty();

        Map.Entry<String, CacheEntry<?>> eldest = it.next();
        it.remove();
        tagIndex.remove(eldest.getKey(), eldest.getValue().getTags());

        return Optional.of(eldest.getKey());
    }

    private CacheEntry<?> removeLocked(String key) {
        CacheEntry<?> removed = entries.remove(key);
        if (removed != null) tagIndex.remove(key, removed.getTags());

        return removed;
    }
}
