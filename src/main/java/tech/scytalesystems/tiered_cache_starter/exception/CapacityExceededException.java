package tech.scytalesystems.tiered_cache_starter.exception;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0908h
 * <p>L1 is full and no victim could be evicted. L1 always self-evicts before admitting
 * a new key, so seeing this means the store's bookkeeping is broken.
 */
public class CapacityExceededException extends TieredCacheException {
    public CapacityExceededException(int maxSize) {
        super("L1 store is at capacity (" + maxSize + ") and no entry could be evicted");
    }
}
