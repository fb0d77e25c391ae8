package tech.scytalesystems.tiered_cache_starter.exception;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0906h
 * <p>L2 could not be reached: connection failure, command timeout or a retry budget that ran out.
 */
public class StoreUnavailableException extends TieredCacheException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
