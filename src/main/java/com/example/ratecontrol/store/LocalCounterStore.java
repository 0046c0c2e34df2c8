package com.example.ratecontrol.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process counter store.
 * <p>
 * Used as the only store when no distributed backend is configured, and as the fallback while the
 * distributed one is unreachable. State is neither shared across instances nor kept across restarts.
 * <p>
 * Every mutation goes through {@link ConcurrentMap#compute}, so increments, expiry refreshes and the
 * background sweep never observe a half-written entry. Expired entries are dropped lazily on read and
 * in bulk by a sweep that runs on a fixed interval.
 */
public class LocalCounterStore implements CounterStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalCounterStore.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;
    private final ScheduledExecutorService sweeper;
    private volatile boolean closed;

    /**
     * @param defaultTtl    TTL given to a counter created by a bare {@link #increment}
     * @param sweepInterval how often expired counters are purged
     */
    public LocalCounterStore(Clock clock, Duration defaultTtl, Duration sweepInterval) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "rate-limit-local-sweep");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Local counter store started (defaultTtl={}, sweepInterval={})", defaultTtl, sweepInterval);
    }

    @Override
    public OptionalLong get(String key) {
        ensureOpen();
        long now = clock.millis();
        Entry entry = entries.get(key);
        if (entry == null) {
            return OptionalLong.empty();
        }
        if (entry.isExpired(now)) {
            entries.remove(key, entry);
            return OptionalLong.empty();
        }
        return OptionalLong.of(entry.count);
    }

    @Override
    public long increment(String key) {
        ensureOpen();
        long now = clock.millis();
        Entry updated = entries.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return new Entry(1, now + defaultTtl.toMillis());
            }
            return new Entry(existing.count + 1, existing.expiresAt);
        });
        return updated.count;
    }

    @Override
    public void expire(String key, Duration ttl) {
        ensureOpen();
        long now = clock.millis();
        entries.computeIfPresent(key, (k, existing) ->
                existing.isExpired(now) ? null : new Entry(existing.count, now + ttl.toMillis()));
    }

    @Override
    public CounterUpdate incrementIfBelow(String key, long limit, Duration ttl) {
        ensureOpen();
        long now = clock.millis();
        CounterUpdate[] outcome = new CounterUpdate[1];
        entries.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                outcome[0] = CounterUpdate.accepted(1);
                return new Entry(1, now + ttl.toMillis());
            }
            if (existing.count >= limit) {
                outcome[0] = CounterUpdate.rejected(existing.count);
                return existing;
            }
            outcome[0] = CounterUpdate.accepted(existing.count + 1);
            return new Entry(existing.count + 1, existing.expiresAt);
        });
        return outcome[0];
    }

    @Override
    public String name() {
        return "local";
    }

    /**
     * Drops every expired counter.
     *
     * @return how many counters were removed
     */
    public int sweepExpired() {
        long now = clock.millis();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Swept {} expired rate-limit counters, {} remain", removed, entries.size());
        }
        return Math.max(removed, 0);
    }

    @Override
    public void close() {
        closed = true;
        sweeper.shutdownNow();
        entries.clear();
    }

    private void sweepSafely() {
        try {
            sweepExpired();
        } catch (RuntimeException ex) {
            // An exception would cancel the scheduled task for good.
            log.error("Local counter sweep failed", ex);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new CounterStoreException("Local counter store is closed");
        }
    }

    private static final class Entry {
        private final long count;
        private final long expiresAt;

        private Entry(long count, long expiresAt) {
            this.count = count;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(long now) {
            return now >= expiresAt;
        }
    }
}
