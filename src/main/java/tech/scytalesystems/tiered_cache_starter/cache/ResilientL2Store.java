package tech.scytalesystems.tiered_cache_starter.cache;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import tech.scytalesystems.tiered_cache_starter.exception.StoreUnavailableException;
import tech.scytalesystems.tiered_cache_starter.exception.TieredCacheException;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * @author Gathariki Ngigi
 * Created on 19/10/2026
 * Time 1045h
 * <p>Decorator that bounds every L2 call in time and retries transient failures.
 *
 * <p>- Timeout: each attempt runs on a dedicated pool under a Resilience4j {@link TimeLimiter};
 * an attempt that overruns is cancelled and counts as {@link StoreUnavailableException}.
 * <p>- Retry: up to {@code maxRetries} extra attempts, {@code retryDelay} apart, through a
 * Resilience4j {@link Retry}. Only unavailability is retried; a serialization error fails at once.
 *
 * <p>No call ever blocks longer than roughly {@code (maxRetries + 1) * (timeout + retryDelay)}.
 */
public class ResilientL2Store implements L2Store, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilientL2Store.class);

    private final L2Store delegate;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;

    public ResilientL2Store(L2Store delegate, int maxRetries, Duration retryDelay, Duration timeout, int poolSize) {
        this.delegate = delegate;

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxRetries + 1))
                .waitDuration(retryDelay)
                .retryOnException(e -> e instanceof StoreUnavailableException || e instanceof TimeoutException)
                .build();
        this.retry = Retry.of("tiered-cache-l2", retryConfig);
        this.retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying L2 call (attempt {}): {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));

        this.timeLimiter = TimeLimiter.of("tiered-cache-l2", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tiered-cache-l2-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newFixedThreadPool(Math.max(1, poolSize), threadFactory);
    }

    @Override
    public Optional<Object> get(String key) {
        return call("get", key, () -> delegate.get(key));
    }

    @Override
    public void setWithTtl(String key, Object value, long ttlSeconds, Set<String> tags) {
        call("set", key, () -> {
            delegate.setWithTtl(key, value, ttlSeconds, tags);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        call("delete", key, () -> {
            delegate.delete(key);
            return null;
        });
    }

    @Override
    public Set<String> keysWithTag(String tag) {
        return call("keysWithTag", tag, () -> delegate.keysWithTag(tag));
    }

    @Override
    public void removeFromTagIndex(String tag, Collection<String> keys) {
        call("removeFromTagIndex", tag, () -> {
            delegate.removeFromTagIndex(tag, keys);
            return null;
        });
    }

    @Override
    public Duration ping() {
        return call("ping", "-", delegate::ping);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) log.warn("L2 executor did not terminate within 1s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <R> R call(String operation, String key, Supplier<R> action) {
        Callable<R> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(action, executor));
        Callable<R> guarded = Retry.decorateCallable(retry, timed);

        try {
            return guarded.call();
        } catch (TieredCacheException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new StoreUnavailableException("L2 " + operation + " timed out for key: " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("L2 " + operation + " interrupted for key: " + key, e);
        } catch (Exception e) {
            throw new StoreUnavailableException("L2 " + operation + " failed for key: " + key, e);
        }
    }
}
