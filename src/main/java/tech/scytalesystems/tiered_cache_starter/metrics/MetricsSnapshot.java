package tech.scytalesystems.tiered_cache_starter.metrics;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1115h
 * <p>Point-in-time view of cache telemetry.
 * <p>The overall hit rate is measured per request: every request starts with an L1 lookup, and it
 * is a hit if either tier served it.
 *
 * @param timestamp             when the snapshot was taken
 * @param tiers                 per-tier counters
 * @param averageResponseTimeMs mean duration of a coordinator read, in milliseconds
 */
public record MetricsSnapshot(Instant timestamp, Map<CacheTier, TierStats> tiers, double averageResponseTimeMs) {
    public MetricsSnapshot {
        Map<CacheTier, TierStats> copy = new EnumMap<>(CacheTier.class);
        for (CacheTier tier : CacheTier.values()) {
            copy.put(tier, tiers != null ? tiers.getOrDefault(tier, TierStats.EMPTY) : TierStats.EMPTY);
        }
        tiers = Map.copyOf(copy);
    }

    public TierStats tier(CacheTier tier) {
        return tiers.get(tier);
    }

    public long totalRequests() {
        return tier(CacheTier.L1).requests();
    }

    public double overallHitRate() {
        long requests = totalRequests();
        if (requests == 0) return 0.0;

        return (double) (tier(CacheTier.L1).hits() + tier(CacheTier.L2).hits()) / requests;
    }
}
