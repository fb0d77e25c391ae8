package tech.scytalesystems.tiered_cache_starter.invalidation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;
import tech.scytalesystems.tiered_cache_starter.exception.TieredCacheException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1320h
 * <p>Applies invalidation requests to both tiers.
 *
 * <p>Tag invalidation flow:
 * <p>1. For every tag, union the keys from the L1 index and the L2 index (a Redis set, no scan)
 * <p>2. Delete each distinct key from L1 and L2
 * <p>3. Remove the deleted keys from the L2 tag set
 * <p>4. Broadcast the keys so other instances drop their L1 copies
 *
 * <p>Best effort: an L2 failure on one key (or on one tag lookup) is recorded and the broker moves on.
 * The returned {@link InvalidationResult} lists what could not be invalidated; nothing is thrown.
 *
 * <p>A key whose entry carried several tags stays listed in the other tags' L2 sets after its
 * deletion. Such members point at nothing, deleting them again is a no-op and the sets expire
 * with their longest-lived entry.
 */
public class InvalidationBroker implements InvalidationHandler {
    private static final Logger log = LoggerFactory.getLogger(InvalidationBroker.class);

    private final TieredCacheCoordinator coordinator;

    public InvalidationBroker(TieredCacheCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public InvalidationResult handle(List<String> tags) {
        return invalidateByTags(tags);
    }

    public InvalidationResult invalidate(String key) {
        Objects.requireNonNull(key, "key");

        boolean deleted = coordinator.deleteLocally(key);
        coordinator.getRemotePublisher().publishEviction(Set.of(key));

        return deleted
                ? new InvalidationResult(Set.of(key), Set.of(), Set.of())
                : new InvalidationResult(Set.of(), Set.of(key), Set.of());
    }

    public InvalidationResult invalidateByTags(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) return InvalidationResult.empty();

        Map<String, Set<String>> keysByTag = new LinkedHashMap<>();
        Set<String> failedTags = new LinkedHashSet<>();
        Set<String> allKeys = new LinkedHashSet<>();

        for (String tag : new LinkedHashSet<>(tags)) {
            Set<String> keys = new LinkedHashSet<>(coordinator.getL1Store().keysWithTag(tag));

            try {
                keys.addAll(coordinator.getL2Store().keysWithTag(tag));
            } catch (TieredCacheException e) {
                failedTags.add(tag);
                log.warn("L2 tag index lookup failed, invalidating L1 keys only: tag={}, error={}", tag, e.getMessage());
            }

            keysByTag.put(tag, keys);
            allKeys.addAll(keys);
        }

        Set<String> invalidated = new LinkedHashSet<>();
        Set<String> failedKeys = new LinkedHashSet<>();

        for (String key : allKeys) {
            if (coordinator.deleteFromTiers(key)) invalidated.add(key);
            else failedKeys.add(key);
        }

        keysByTag.forEach((tag, keys) -> cleanTagIndex(tag, keys, failedKeys));

        if (!allKeys.isEmpty()) coordinator.getRemotePublisher().publishEviction(allKeys);

        log.info("Invalidated by tags {}: {} key(s) removed, {} failed, {} tag lookup(s) failed",
                keysByTag.keySet(), invalidated.size(), failedKeys.size(), failedTags.size());

        return new InvalidationResult(invalidated, failedKeys, failedTags);
    }

    private void cleanTagIndex(String tag, Set<String> keys, Set<String> failedKeys) {
        Set<String> removable = new LinkedHashSet<>(keys);
        removable.removeAll(failedKeys);

        if (removable.isEmpty()) return;

        try {
            coordinator.getL2Store().removeFromTagIndex(tag, removable);
        } catch (TieredCacheException e) {
            // Members left behind point at deleted keys and expire with the set
            log.warn("Could not prune L2 tag index: tag={}, keys={}, error={}", tag, removable.size(), e.getMessage());
        }
    }
}
