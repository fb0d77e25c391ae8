package tech.scytalesystems.tiered_cache_starter.metrics;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1112h
 * <p>Counters of one tier over one collection interval.
 */
public record TierStats(long hits, long misses, long evictions, long errors) {
    public static final TierStats EMPTY = new TierStats(0, 0, 0, 0);

    public long requests() {
        return hits + misses;
    }

    /**
     * @return hits / (hits + misses), or 0 when the tier saw no lookups
     */
    public double hitRate() {
        long requests = requests();

        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
