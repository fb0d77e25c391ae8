package tech.scytalesystems.tiered_cache_starter.cache;

import tech.scytalesystems.tiered_cache_starter.exception.CacheSerializationException;
import tech.scytalesystems.tiered_cache_starter.exception.StoreUnavailableException;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1005h
 * <p>Client to the shared, TTL-capable key-value backend that forms the L2 tier.
 * <p>The backend expires keys natively, so there is no sweep on this tier. Tag lookups are served
 * from a per-tag key set kept next to the data, never from a keyspace scan.
 * <p>All methods may throw {@link StoreUnavailableException} or {@link CacheSerializationException}.
 */
public interface L2Store {

    Optional<Object> get(String key);

    /**
     * Stores {@code value} for {@code ttlSeconds} and adds {@code key} to the index set of each tag,
     * extending that set's TTL to at least {@code ttlSeconds}. Index updates are additive.
     */
    void setWithTtl(String key, Object value, long ttlSeconds, Set<String> tags);

    /**
     * Removes the value. Index membership is cleaned up separately through
     * {@link #removeFromTagIndex}, stale members are tolerated until their set expires.
     */
    void delete(String key);

    Set<String> keysWithTag(String tag);

    void removeFromTagIndex(String tag, Collection<String> keys);

    /**
     * Round-trip latency to the backend.
     */
    Duration ping();
}
