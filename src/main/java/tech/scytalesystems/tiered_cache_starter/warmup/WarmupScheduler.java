package tech.scytalesystems.tiered_cache_starter.warmup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tech.scytalesystems.tiered_cache_starter.cache.TieredCacheCoordinator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1350h
 * <p>Preloads keys ahead of demand.
 *
 * <p>Keys are processed in batches: loaders inside a batch run concurrently on a bounded pool, and
 * the next batch starts only once the current one has finished. The call returns when every batch
 * is done; there is no mid-run cancellation.
 *
 * <p>Idempotent: a key already present in either tier is skipped without calling its loader, so
 * repeated warmups do not stampede the origin. A loader that throws or returns null is logged and
 * skipped; it never aborts its batch or the run, even when it throws an Error.
 *
 * <p>Once closed, further warmups are rejected with {@link IllegalStateException}.
 */
public class WarmupScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WarmupScheduler.class);

    private final TieredCacheCoordinator coordinator;
    private final int defaultBatchSize;
    private final ExecutorService executor;

    public WarmupScheduler(TieredCacheCoordinator coordinator, int defaultBatchSize, int parallelism) {
        if (defaultBatchSize < 1) throw new IllegalArgumentException("batchSize must be at least 1, got " + defaultBatchSize);

        this.coordinator = coordinator;
        this.defaultBatchSize = defaultBatchSize;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tiered-cache-warmup-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newFixedThreadPool(Math.max(1, parallelism), threadFactory);
    }

    public <T> WarmupReport warmup(Collection<String> keys, Function<String, T> loader) {
        return warmup(keys, loader, defaultBatchSize);
    }

    public <T> WarmupReport warmup(Collection<String> keys, Function<String, T> loader, int batchSize) {
        return warmup(keys, loader, batchSize, coordinator.getL2DefaultTtlSeconds(), Set.of());
    }

    public <T> WarmupReport warmup(Collection<String> keys, Function<String, T> loader, int batchSize,
                                   long ttlSeconds, Collection<String> tags) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        if (executor.isShutdown()) throw new IllegalStateException("WarmupScheduler is closed");

        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
        List<String> loaded = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        log.info("Cache warmup started: {} key(s), batchSize={}", distinct.size(), batchSize);

        for (int from = 0; from < distinct.size(); from += batchSize) {
            List<String> batch = distinct.subList(from, Math.min(from + batchSize, distinct.size()));

            List<CompletableFuture<Outcome>> futures = new ArrayList<>(batch.size());
            for (String key : batch) {
                futures.add(CompletableFuture.supplyAsync(() -> warmOne(key, loader, ttlSeconds, tags), executor)
                        .exceptionally(e -> {
                            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                            log.error("Warmup loader failed: key={}, error={}", key, cause.toString(), cause);
                            return Outcome.FAILED;
                        }));
            }

            // Wait for the whole batch before starting the next one
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            for (int i = 0; i < batch.size(); i++) {
                switch (futures.get(i).join()) {
                    case LOADED -> loaded.add(batch.get(i));
                    case SKIPPED -> skipped.add(batch.get(i));
                    case FAILED -> failed.add(batch.get(i));
                }
            }

            log.debug("Warmup batch {}-{} done", from, from + batch.size() - 1);
        }

        log.info("Cache warmup finished: loaded={}, skipped={}, failed={}", loaded.size(), skipped.size(), failed.size());

        return new WarmupReport(loaded, skipped, failed);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) log.warn("Warmup executor did not terminate within 1s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <T> Outcome warmOne(String key, Function<String, T> loader, long ttlSeconds, Collection<String> tags) {
        try {
            if (coordinator.get(key) != null) {
                log.trace("Warmup skipped, already cached: key={}", key);
                return Outcome.SKIPPED;
            }

            T value = loader.apply(key);
            if (value == null) {
                log.warn("Warmup loader returned null: key={}", key);
                return Outcome.FAILED;
            }

            coordinator.set(key, value, ttlSeconds, tags);
            return Outcome.LOADED;
        } catch (Exception e) {
            log.warn("Warmup loader failed: key={}, error={}", key, e.getMessage(), e);
            return Outcome.FAILED;
        }
    }

    private enum Outcome {
        LOADED,
        SKIPPED,
        FAILED
    }
}
