package tech.scytalesystems.tiered_cache_starter.exception;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0907h
 * <p>A value could not be encoded for, or decoded from, L2.
 */
public class CacheSerializationException extends TieredCacheException {
    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
