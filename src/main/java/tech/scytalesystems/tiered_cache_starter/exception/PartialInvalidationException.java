package tech.scytalesystems.tiered_cache_starter.exception;

import java.util.Set;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0909h
 * <p>Some keys (or whole tags) could not be removed from L2 during an invalidation.
 * <p>The broker never throws this itself; it is raised by
 * {@code InvalidationResult.throwIfFailed()} for callers that prefer an exception.
 */
public class PartialInvalidationException extends TieredCacheException {
    private final Set<String> failedKeys;
    private final Set<String> failedTags;

    public PartialInvalidationException(Set<String> failedKeys, Set<String> failedTags) {
        super("Invalidation incomplete: " + failedKeys.size() + " key(s) and " + failedTags.size() + " tag(s) failed");
        this.failedKeys = Set.copyOf(failedKeys);
        this.failedTags = Set.copyOf(failedTags);
    }

    public Set<String> getFailedKeys() {
        return failedKeys;
    }

    public Set<String> getFailedTags() {
        return failedTags;
    }
}
