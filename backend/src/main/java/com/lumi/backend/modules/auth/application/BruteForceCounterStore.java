package com.lumi.backend.modules.auth.application;

import java.time.Duration;

/**
 * Failed-attempt counters keyed by normalized email. A counter restarts once its window elapses.
 */
public interface BruteForceCounterStore {

    /**
     * Atomically adds one attempt and returns the count within the current window.
     */
    int increment(String key, Duration window);

    int get(String key, Duration window);

    void delete(String key);
}
