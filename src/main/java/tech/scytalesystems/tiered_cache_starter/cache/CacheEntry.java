package tech.scytalesystems.tiered_cache_starter.cache;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0915h
 * <p>Value wrapper held by the L1 tier.
 * <p>Data, TTL, tags and creation time are fixed at construction. {@code accessedAt} and
 * {@code accessCount} are updated by {@link L1Store} on every hit, always under the store lock.
 *
 * @param <T> cached value type
 */
public final class CacheEntry<T> {
    private final T data;
    private final long ttlSeconds;
    private final Set<String> tags;
    private final Instant createdAt;
    private Instant accessedAt;
    private long accessCount;

    public CacheEntry(T data, long ttlSeconds, Set<String> tags, Instant createdAt) {
        if (ttlSeconds <= 0) throw new IllegalArgumentException("ttlSeconds must be > 0, got " + ttlSeconds);

        this.data = Objects.requireNonNull(data, "data");
        this.ttlSeconds = ttlSeconds;
        this.tags = tags == null ? Set.of() : Set.copyOf(tags);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.accessedAt = createdAt;
        this.accessCount = 0;
    }

    /**
     * An entry is expired once {@code now} is strictly past {@code createdAt + ttlSeconds}.
     */
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt());
    }

    public Instant expiresAt() {
        return createdAt.plusSeconds(ttlSeconds);
    }

    void recordAccess(Instant now) {
        this.accessedAt = now;
        this.accessCount++;
    }

    // GETTERS
    public T getData() {
        return data;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getAccessedAt() {
        return accessedAt;
    }

    public long getAccessCount() {
        return accessCount;
    }

    @Override
    public String toString() {
        return "CacheEntry{" +
                "ttlSeconds=" + ttlSeconds +
                ", tags=" + tags +
                ", createdAt=" + createdAt +
                ", accessedAt=" + accessedAt +
                ", accessCount=" + accessCount +
                '}';
    }
}
