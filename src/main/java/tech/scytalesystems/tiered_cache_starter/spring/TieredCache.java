package tech.scytalesystems.tiered_cache_starter.spring;

import org.springframework.cache.Cache;
import org.springframework.cache.support.SimpleValueWrapper;
import org.springframework.lang.NonNull;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.invalidation.InvalidationBroker;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * @param name        Spring cache name, also the tag every entry of this cache carries
 * @param coordinator the shared L1/L2 coordinator
 * @param broker      used by {@link #clear()}
 * @param ttlSeconds  TTL applied to {@link #put(Object, Object)}
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1435h
 * <p>Spring {@link Cache} view over the tiered cache, so {@code @Cacheable} and {@code @CacheEvict} work
 * unchanged.
 *
 * <p>All caches share one coordinator; keys are namespaced as {@code <name>::<key>}. Clearing a cache
 * is a tag invalidation of its name, which reaches L2 and every instance's L1.
 *
 * <p>Null values are not stored: a {@code put} of null evicts the key.
 */
public record TieredCache(String name,
                          TieredCacheCoordinator coordinator,
                          InvalidationBroker broker,
                          long ttlSeconds) implements Cache {
    static final String KEY_SEPARATOR = "::";

    @Override
    public @NonNull String getName() {
        return name;
    }

    @Override
    public @NonNull Object getNativeCache() {
        return coordinator;
    }

    @Override
    public ValueWrapper get(@NonNull Object key) {
        Object value = coordinator.get(cacheKey(key));

        return value != null ? new SimpleValueWrapper(value) : null;
    }

    @Override
    public <T> T get(@NonNull Object key, Class<T> type) {
        if (type == null) {
            @SuppressWarnings("unchecked")
            T value = (T) coordinator.get(cacheKey(key));
            return value;
        }

        return coordinator.get(cacheKey(key), type);
    }

    @Override
    public <T> T get(@NonNull Object key, @NonNull Callable<T> valueLoader) {
        try {
            return coordinator.getOrLoad(cacheKey(key), () -> call(valueLoader), ttlSeconds, Set.of(name));
        } catch (LoaderException e) {
            throw new ValueRetrievalException(key, valueLoader, e.getCause());
        }
    }

    @Override
    public void put(@NonNull Object key, Object value) {
        if (value == null) {
            evict(key);
            return;
        }

        coordinator.set(cacheKey(key), value, ttlSeconds, Set.of(name));
    }

    @Override
    public ValueWrapper putIfAbsent(@NonNull Object key, Object value) {
        ValueWrapper existing = get(key);
        if (existing != null) return existing;

        put(key, value);
        return null;
    }

    @Override
    public void evict(@NonNull Object key) {
        coordinator.delete(cacheKey(key));
    }

    @Override
    public boolean evictIfPresent(@NonNull Object key) {
        String cacheKey = cacheKey(key);
        boolean present = coordinator.exists(cacheKey);

        coordinator.delete(cacheKey);
        return present;
    }

    @Override
    public void clear() {
        broker.invalidateByTags(List.of(name));
    }

    String cacheKey(Object key) {
        return name + KEY_SEPARATOR + key;
    }

    private static <T> T call(Callable<T> valueLoader) {
        try {
            return valueLoader.call();
        } catch (Exception e) {
            throw new LoaderException(e);
        }
    }

    /**
     * Carries a checked loader exception through the coordinator's {@code Supplier}.
     */
    private static final class LoaderException extends RuntimeException {
        LoaderException(Throwable cause) {
            super(cause);
        }
    }
}
