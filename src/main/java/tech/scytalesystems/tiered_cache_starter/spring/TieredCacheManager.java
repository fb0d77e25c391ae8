package tech.scytalesystems.tiered_cache_starter.spring;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.lang.NonNull;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationBroker;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1440h
 * <p>Hands out one {@link TieredCache} per name, created on first use. Every cache is backed by
 * the same coordinator.
 */
public class TieredCacheManager implements CacheManager {
    private final TieredCacheCoordinator coordinator;
    private final InvalidationBroker broker;
    private final long ttlSeconds;
    private final ConcurrentMap<String, TieredCache> caches = new ConcurrentHashMap<>();

    public TieredCacheManager(TieredCacheCoordinator coordinator, InvalidationBroker broker, long ttlSeconds) {
        this.coordinator = coordinator;
        this.broker = broker;
        this.ttlSeconds = ttlSeconds;
    }

    @Override
    public Cache getCache(@NonNull String name) {
        return caches.computeIfAbsent(name, n -> new TieredCache(n, coordinator, broker, ttlSeconds));
    }

    @Override
    public @NonNull Collection<String> getCacheNames() {
        return List.copyOf(caches.keySet());
    }
}
