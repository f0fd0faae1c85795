package com.gt.studyplanner.metrics;

import com.gt.studyplanner.conf.CachingConfig;
import com.gt.studyplanner.exception.DaoException;
import com.gt.studyplanner.model.PerformanceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Snapshot access for interactive requests. History loads that run past the configured timeout fall back to the
 * last snapshot computed for the same learner, course and window, or to the all-zero snapshot when there is none.
 * Errors raised by the load itself are passed through unchanged.
 */
@Component
public class SnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private final MetricsAggregator metricsAggregator;
    private final Cache snapshotCache;
    private final Executor historyQueryExecutor;
    private final long timeoutMs;

    @Autowired
    public SnapshotService(MetricsAggregator metricsAggregator,
                           CacheManager cacheManager,
                           @Qualifier("historyQueryExecutor") Executor historyQueryExecutor,
                           @Value("${planner.metrics.snapshotTimeoutMs:5000}") long timeoutMs) {
        this.metricsAggregator = metricsAggregator;
        this.snapshotCache = cacheManager.getCache(CachingConfig.SNAPSHOTS);
        this.historyQueryExecutor = historyQueryExecutor;
        this.timeoutMs = timeoutMs;
    }

    public PerformanceSnapshot getSnapshot(String learnerId, Optional<String> courseId, int windowDays, Instant now) {
        String key = cacheKey("snapshot", learnerId, courseId, windowDays, 1);

        return loadWithFallback(
                key,
                () -> metricsAggregator.aggregate(learnerId, courseId, windowDays, now),
                () -> PerformanceSnapshot.empty(learnerId, courseId.orElse(null), windowDays, now));
    }

    public List<PerformanceSnapshot> getSnapshotSeries(String learnerId, Optional<String> courseId, int windowDays, int points, Instant now) {
        String key = cacheKey("series", learnerId, courseId, windowDays, points);

        return loadWithFallback(
                key,
                () -> metricsAggregator.aggregateSeries(learnerId, courseId, windowDays, points, now),
                () -> {
                    List<PerformanceSnapshot> empty = new ArrayList<>(points);
                    for (int i = 0; i < points; i++) {
                        empty.add(PerformanceSnapshot.empty(learnerId, courseId.orElse(null), windowDays, now));
                    }
                    return empty;
                });
    }

    @SuppressWarnings("unchecked")
    private <T> T loadWithFallback(String key, Supplier<T> loader, Supplier<T> emptyValue) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(loader, historyQueryExecutor);

        try {
            T value = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            snapshotCache.put(key, value);
            return value;
        } catch (TimeoutException ex) {
            future.cancel(true);

            Cache.ValueWrapper cached = snapshotCache.get(key);
            if (cached != null) {
                log.warn("History load for {} exceeded {} ms, using cached value", key, timeoutMs);
                return (T) cached.get();
            }

            log.warn("History load for {} exceeded {} ms and nothing is cached, using empty history", key, timeoutMs);
            return emptyValue.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new DaoException("History load for " + key + " failed", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DaoException("Interrupted while loading history for " + key, ex);
        }
    }

    private static String cacheKey(String kind, String learnerId, Optional<String> courseId, int windowDays, int points) {
        return kind + ":" + learnerId + ":" + courseId.orElse("*") + ":" + windowDays + ":" + points;
    }
}
