package com.lumi.backend.modules.auth.infrastructure.bruteforce;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.lumi.backend.support.MutableClock;

import org.junit.jupiter.api.Test;

class InMemoryBruteForceCounterStoreTest {

    private static final Duration WINDOW = Duration.ofMinutes(15);

    private final MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
    private final InMemoryBruteForceCounterStore store = new InMemoryBruteForceCounterStore(clock);

    @Test
    void countsWithinWindowAndRestartsAfterIt() {
        assertThat(store.increment("k", WINDOW)).isEqualTo(1);
        clock.advance(Duration.ofMinutes(10));
        assertThat(store.increment("k", WINDOW)).isEqualTo(2);
        assertThat(store.get("k", WINDOW)).isEqualTo(2);

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.get("k", WINDOW)).isZero();
        assertThat(store.increment("k", WINDOW)).isEqualTo(1);
    }

    @Test
    void deleteForgetsTheKey() {
        store.increment("k", WINDOW);
        store.delete("k");

        assertThat(store.get("k", WINDOW)).isZero();
        assertThat(store.get("unknown", WINDOW)).isZero();
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.increment("shared", WINDOW);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get("shared", WINDOW)).isEqualTo(threads * perThread);
    }

    @Test
    void keysAreEvictedOnceTheirWindowElapses() {
        InMemoryBruteForceCounterStore bounded = new InMemoryBruteForceCounterStore(clock, 100_000, Runnable::run);
        for (int i = 0; i < 5_000; i++) {
            bounded.increment("unknown-" + i + "@example.com", WINDOW);
        }
        assertThat(bounded.trackedKeys()).isEqualTo(5_000);

        clock.advance(Duration.ofDays(30));
        bounded.increment("fresh@example.com", WINDOW);

        assertThat(bounded.trackedKeys()).isEqualTo(1);
    }

    @Test
    void trackedKeysNeverExceedTheMaximumSize() {
        InMemoryBruteForceCounterStore bounded = new InMemoryBruteForceCounterStore(clock, 50, Runnable::run);
        for (int i = 0; i < 1_000; i++) {
            bounded.increment("key-" + i, WINDOW);
        }

        assertThat(bounded.trackedKeys()).isLessThanOrEqualTo(50);
    }
}
