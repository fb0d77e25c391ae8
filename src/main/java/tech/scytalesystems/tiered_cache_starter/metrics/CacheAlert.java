package tech.scytalesystems.tiered_cache_starter.metrics;

import java.time.Instant;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1118h
 * <p>Raised by {@link MetricsCollector#collect()} when a collected interval breaches a threshold.
 */
public record CacheAlert(Type type, double observed, double threshold, Instant timestamp, String message) {
    public enum Type {
        LOW_L1_HIT_RATE,
        HIGH_RESPONSE_TIME
    }
}
