package tech.scytalesystems.tiered_cache_starter.metrics;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1110h
 */
public enum CacheTier {
    /** In-process store. */
    L1,
    /** Shared Redis store. */
    L2
}
