package tech.scytalesystems.tiered_cache_starter.cache;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 0934h
 * <p>Notified by {@link L1Store} whenever an entry leaves the store without an explicit delete.
 */
@FunctionalInterface
public interface EvictionListener {
    EvictionListener NO_OP = (key, cause) -> { };

    void onEviction(String key, RemovalCause cause);

    enum RemovalCause {
        /** Dropped to make room for a new key. */
        SIZE,
        /** TTL lapsed; found either by a read or by the sweep. */
        EXPIRED
    }
}
