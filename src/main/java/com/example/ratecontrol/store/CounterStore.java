package com.example.ratecontrol.store;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Bounded, expiring counters keyed by window bucket.
 * <p>
 * Missing keys are never an error: {@link #get} answers empty and {@link #increment} starts at 1.
 * The only expected failure is the backend itself being unreachable, reported as
 * {@link CounterStoreException} so callers can fall back to another store.
 */
public interface CounterStore {

    OptionalLong get(String key);

    /**
     * @return the count after incrementing.
     */
    long increment(String key);

    /**
     * Sets or refreshes the time-to-live of an existing counter. No-op for missing keys.
     */
    void expire(String key, Duration ttl);

    /**
     * Increments the counter unless it already reached {@code limit}. The first increment in a
     * bucket sets its TTL.
     * <p>
     * This default is the plain get, increment, expire sequence and is therefore racy: concurrent
     * callers may both read the same count and both increment. Stores that can do better override it
     * with a single atomic operation.
     */
    default CounterUpdate incrementIfBelow(String key, long limit, Duration ttl) {
        long current = get(key).orElse(0L);
        if (current >= limit) {
            return CounterUpdate.rejected(current);
        }
        long updated = increment(key);
        if (updated == 1) {
            expire(key, ttl);
        }
        return CounterUpdate.accepted(updated);
    }

    /**
     * Short name used in logs.
     */
    String name();
}
