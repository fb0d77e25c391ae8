package tech.scytalesystems.tiered_cache_starter.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1200h
 * <p>
 * Configuration properties for the tiered cache starter, bound from {@code app.cache.*}.
 * These properties are validated on application startup.
 */
@Validated
@ConfigurationProperties("app.cache")
@SuppressWarnings("unused")
public class TieredCacheProperties {

    /**
     * Whether to enable the tiered cache auto-configuration.
     */
    private boolean enabled = true;

    @Valid
    @NotNull
    private L1 l1 = new L1();

    @Valid
    @NotNull
    private L2 l2 = new L2();

    @Valid
    @NotNull
    private Metrics metrics = new Metrics();

    @Valid
    @NotNull
    private Warmup warmup = new Warmup();

    @Valid
    @NotNull
    private Sync sync = new Sync();

    // GETTERS
    public boolean isEnabled() {
        return enabled;
    }

    public L1 getL1() {
        return l1;
    }

    public L2 getL2() {
        return l2;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Warmup getWarmup() {
        return warmup;
    }

    public Sync getSync() {
        return sync;
    }

    // SETTERS
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setL1(L1 l1) {
        this.l1 = l1;
    }

    public void setL2(L2 l2) {
        this.l2 = l2;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = metrics;
    }

    public void setWarmup(Warmup warmup) {
        this.warmup = warmup;
    }

    public void setSync(Sync sync) {
        this.sync = sync;
    }

    /**
     * In-process tier.
     */
    public static class L1 {
        /**
         * The maximum number of entries held in L1. Inserting past it evicts the least-recently-used entry.
         */
        @Min(value = 1, message = "L1 max size must be at least 1")
        private int maxSize = 1000;

        /**
         * Upper bound on the TTL of an L1 entry, also used for entries backfilled from L2.
         */
        @Min(value = 1, message = "L1 default TTL must be at least 1 second")
        private long defaultTtlSeconds = 300;

        /**
         * How often the background sweep removes expired L1 entries.
         */
        @Min(value = 1, message = "L1 sweep interval must be at least 1 second")
        private long sweepIntervalSeconds = 60;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public long getDefaultTtlSeconds() {
            return defaultTtlSeconds;
        }

        public void setDefaultTtlSeconds(long defaultTtlSeconds) {
            this.defaultTtlSeconds = defaultTtlSeconds;
        }

        public long getSweepIntervalSeconds() {
            return sweepIntervalSeconds;
        }

        public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
            this.sweepIntervalSeconds = sweepIntervalSeconds;
        }
    }

    /**
     * Shared Redis tier.
     */
    public static class L2 {
        /**
         * TTL used when a write does not specify one.
         */
        @Min(value = 1, message = "L2 default TTL must be at least 1 second")
        private long defaultTtlSeconds = 1800;

        /**
         * Prefix applied to every Redis key (values and tag sets) to keep the cache's namespace apart.
         */
        @NotNull(message = "L2 key prefix cannot be null")
        private String keyPrefix = "cache:";

        /**
         * Extra attempts after a failed L2 call. 0 disables retries.
         */
        @Min(value = 0, message = "L2 max retries cannot be negative")
        private int maxRetries = 2;

        /**
         * Pause between L2 attempts.
         */
        @Min(value = 0, message = "L2 retry delay cannot be negative")
        private long retryDelayMs = 100;

        /**
         * Upper bound on a single L2 attempt. An attempt that overruns counts as a failure.
         */
        @Min(value = 1, message = "L2 timeout must be at least 1 ms")
        private long timeoutMs = 500;

        /**
         * Threads available for concurrent L2 calls.
         */
        @Min(value = 1, message = "L2 pool size must be at least 1")
        private int poolSize = 16;

        public long getDefaultTtlSeconds() {
            return defaultTtlSeconds;
        }

        public void setDefaultTtlSeconds(long defaultTtlSeconds) {
            this.defaultTtlSeconds = defaultTtlSeconds;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    /**
     * Telemetry and alerting.
     */
    public static class Metrics {
        /**
         * How often counters are drained into a snapshot.
         */
        @Min(value = 1, message = "Metrics collect interval must be at least 1 second")
        private long collectIntervalSeconds = 60;

        /**
         * Number of snapshots kept in the rolling window (1440 x 60s = 24h).
         */
        @Min(value = 1, message = "Metrics window size must be at least 1")
        private int windowSize = 1440;

        /**
         * Alert when the L1 hit rate of an interval falls below this ratio.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double l1HitRateThreshold = 0.70;

        /**
         * Alert when the average read time of an interval exceeds this many milliseconds.
         */
        @DecimalMin("0.0")
        private double responseTimeThresholdMs = 100;

        public long getCollectIntervalSeconds() {
            return collectIntervalSeconds;
        }

        public void setCollectIntervalSeconds(long collectIntervalSeconds) {
            this.collectIntervalSeconds = collectIntervalSeconds;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public double getL1HitRateThreshold() {
            return l1HitRateThreshold;
        }

        public void setL1HitRateThreshold(double l1HitRateThreshold) {
            this.l1HitRateThreshold = l1HitRateThreshold;
        }

        public double getResponseTimeThresholdMs() {
            return responseTimeThresholdMs;
        }

        public void setResponseTimeThresholdMs(double responseTimeThresholdMs) {
            this.responseTimeThresholdMs = responseTimeThresholdMs;
        }
    }

    /**
     * Batch preloading.
     */
    public static class Warmup {
        /**
         * Keys loaded concurrently per batch.
         */
        @Min(value = 1, message = "Warmup batch size must be at least 1")
        private int batchSize = 10;

        /**
         * Threads available to warmup loaders.
         */
        @Min(value = 1, message = "Warmup parallelism must be at least 1")
        private int parallelism = 10;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    /**
     * Cross-instance L1 invalidation over Redis Pub/Sub.
     */
    public static class Sync {
        /**
         * Whether invalidations are broadcast to other instances.
         */
        private boolean enabled = true;

        /**
         * A prefix for the Redis channel name to isolate environments (e.g., "prod:", "staging:").
         */
        private String channelPrefix = "";

        /**
         * The base name of the Redis Pub/Sub channel for invalidation messages.
         */
        @NotBlank(message = "Channel name cannot be blank")
        private String channel = "tiered-cache-invalidation";

        /**
         * Whether to GZIP + Base64 messages before publishing. Worth it for large key lists.
         */
        private boolean compressMessages = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getChannelPrefix() {
            return channelPrefix;
        }

        public void setChannelPrefix(String channelPrefix) {
            this.channelPrefix = channelPrefix;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public boolean isCompressMessages() {
            return compressMessages;
        }

        public void setCompressMessages(boolean compressMessages) {
            this.compressMessages = compressMessages;
        }
    }
}
