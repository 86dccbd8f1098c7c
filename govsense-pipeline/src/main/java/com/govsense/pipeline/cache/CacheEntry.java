package com.govsense.pipeline.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One memoized result. Never persisted.
 *
 * @param generation invalidation generation the value was computed in
 */
record CacheEntry(CacheKey key, Object value, Instant insertedAt, Duration ttl, long generation) {

    Instant expiresAt() {
        return insertedAt.plus(ttl);
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
