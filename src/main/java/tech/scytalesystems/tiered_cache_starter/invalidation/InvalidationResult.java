package tech.scytalesystems.tiered_cache_starter.invalidation;

import tech.scytalesystems.tiered_cache_starter.exception.PartialInvalidationException;

import java.util.Set;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1312h
 * <p>Outcome of a best-effort invalidation.
 *
 * @param invalidatedKeys keys removed from both tiers
 * @param failedKeys      keys whose L2 delete failed; callers may retry them with {@code invalidate(key)}
 * @param failedTags      tags whose L2 index could not be read; only their L1 keys were removed
 */
public record InvalidationResult(Set<String> invalidatedKeys, Set<String> failedKeys, Set<String> failedTags) {
    public InvalidationResult {
        invalidatedKeys = Set.copyOf(invalidatedKeys);
        failedKeys = Set.copyOf(failedKeys);
        failedTags = Set.copyOf(failedTags);
    }

    public static InvalidationResult empty() {
        return new InvalidationResult(Set.of(), Set.of(), Set.of());
    }

    public boolean isComplete() {
        return failedKeys.isEmpty() && failedTags.isEmpty();
    }

    /**
     * @throws PartialInvalidationException if anything failed
     */
    public InvalidationResult throwIfFailed() {
        if (!isComplete()) throw new PartialInvalidationException(failedKeys, failedTags);

        return this;
    }
}
