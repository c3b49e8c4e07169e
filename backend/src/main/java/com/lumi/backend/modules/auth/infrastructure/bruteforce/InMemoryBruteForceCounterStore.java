package com.lumi.backend.modules.auth.infrastructure.bruteforce;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.lumi.backend.modules.auth.application.BruteForceCounterStore;

/**
 * Process-local counters held in a bounded Caffeine cache. Every entry expires at the end of its
 * own window, and the cache never holds more than {@code maximumSize} keys. Updates run inside
 * {@code asMap().compute}, so concurrent failures for the same key are never lost.
 */
public class InMemoryBruteForceCounterStore implements BruteForceCounterStore {

    public static final long DEFAULT_MAXIMUM_SIZE = 100_000;

    private final Cache<String, Counter> counters;
    private final Clock clock;

    public InMemoryBruteForceCounterStore(Clock clock) {
        this(clock, DEFAULT_MAXIMUM_SIZE, ForkJoinPool.commonPool());
    }

    public InMemoryBruteForceCounterStore(Clock clock, long maximumSize) {
        this(clock, maximumSize, ForkJoinPool.commonPool());
    }

    InMemoryBruteForceCounterStore(Clock clock, long maximumSize, Executor maintenanceExecutor) {
        this.clock = clock;
        this.counters = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new WindowExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(maintenanceExecutor)
                .build();
    }

    @Override
    public int increment(String key, Duration window) {
        Instant now = clock.instant();
        Counter updated = counters.asMap().compute(key, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                return new Counter(1, now.plus(window));
            }
            return new Counter(current.attempts() + 1, current.expiresAt());
        });
        return updated.attempts();
    }

    @Override
    public int get(String key, Duration window) {
        Counter current = counters.getIfPresent(key);
        if (current == null || current.isExpired(clock.instant())) {
            return 0;
        }
        return current.attempts();
    }

    @Override
    public void delete(String key) {
        counters.invalidate(key);
    }

    /**
     * Number of keys still tracked once expired and excess entries have been evicted.
     */
    long trackedKeys() {
        counters.cleanUp();
        return counters.estimatedSize();
    }

    private record Counter(int attempts, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }

        long expiresAtNanos() {
            return TimeUnit.MILLISECONDS.toNanos(expiresAt.toEpochMilli());
        }
    }

    private static final class WindowExpiry implements Expiry<String, Counter> {

        @Override
        public long expireAfterCreate(String key, Counter value, long currentTime) {
            return Math.max(0, value.expiresAtNanos() - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, Counter value, long currentTime, long currentDuration) {
            return Math.max(0, value.expiresAtNanos() - currentTime);
        }

        @Override
        public long expireAfterRead(String key, Counter value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
