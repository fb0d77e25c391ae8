package tech.scytalesystems.tiered_cache_starter.dto;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1400h
 * <p>What a receiving instance does with its L1.
 */
public enum InvalidationAction {
    /**
     * Drop the listed keys.
     */
    EVICT,

    /**
     * Drop every entry. The message carries no keys.
     */
    CLEAR
}
