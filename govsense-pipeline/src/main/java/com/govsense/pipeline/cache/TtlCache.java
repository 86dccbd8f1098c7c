package com.govsense.pipeline.cache;

import com.govsense.pipeline.config.GovSenseProperties;
import com.govsense.pipeline.model.RefreshCompletedEvent;
import com.govsense.pipeline.scheduler.RefreshListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Memoizes read-side query results until their ttl runs out or the data
 * underneath them changes.
 *
 * Expiry is checked on read. Every invalidation bumps a generation counter;
 * a value whose computation started before an invalidation is returned to
 * its caller but never stored, so it cannot be served after the refresh
 * that superseded it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TtlCache implements RefreshListener {

    private final Clock clock;
    private final GovSenseProperties properties;

    private final Map<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    /**
     * Cached value for {@code key}, computed with the ttl configured for its query type.
     */
    public <T> T getOrCompute(CacheKey key, Supplier<T> compute) {
        return getOrCompute(key, compute, properties.getCache().ttlFor(key.queryType()));
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(CacheKey key, Supplier<T> compute, Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive, got " + ttl);
        }
        long startGeneration = generation.get();
        CacheEntry entry = entries.get(key);
        if (entry != null && entry.generation() == startGeneration && !entry.isExpired(clock.instant())) {
            return (T) entry.value();
        }

        T value = compute.get();
        if (ttl.isZero()) {
            return value;
        }

        CacheEntry fresh = new CacheEntry(key, value, clock.instant(), ttl, startGeneration);
        entries.put(key, fresh);
        if (generation.get() != startGeneration) {
            // invalidated while computing
            entries.remove(key, fresh);
        }
        return value;
    }

    /** Drop every entry. */
    public void invalidateAll() {
        generation.incrementAndGet();
        int dropped = entries.size();
        entries.clear();
        log.info("Cache invalidated ({} entries dropped)", dropped);
    }

    @Override
    public void onRefreshCompleted(RefreshCompletedEvent event) {
        log.debug("Refresh {} completed, invalidating cache", event.runId());
        invalidateAll();
    }

    /**
     * Background sweep for entries nobody reads any more. Reads never depend on it.
     */
    @Scheduled(fixedDelayString = "${govsense.cache.sweep-interval:PT1M}")
    public void evictExpired() {
        Instant now = clock.instant();
        long current = generation.get();
        int before = entries.size();
        entries.values().removeIf(e -> e.isExpired(now) || e.generation() != current);
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired cache entries", evicted);
        }
    }

    public int size() {
        return entries.size();
    }
}
