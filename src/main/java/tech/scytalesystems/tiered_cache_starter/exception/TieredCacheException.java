package tech.scytalesystems.tiered_cache_starter.exception;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0905h
 * <p>Base type for every failure raised by the tiered cache.
 * <p>Unchecked: the coordinator converts store failures into cache misses, so callers
 * only see these when they use the stores or the broker directly.
 */
public class TieredCacheException extends RuntimeException {
    public TieredCacheException(String message) {
        super(message);
    }

    public TieredCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
