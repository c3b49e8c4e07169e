package com.lumi.backend.modules.auth.application;

import java.time.Duration;
import java.util.Locale;

import com.lumi.backend.global.config.AuthProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Short-term, per-email throttle for login attempts: progressive delays and a CAPTCHA hint.
 * Independent of the durable account lockout.
 */
@Component
public class BruteForceGuard {

    private static final Logger log = LoggerFactory.getLogger(BruteForceGuard.class);
    private static final String KEY_PREFIX = "lumi:auth:brute-force:";

    private final BruteForceCounterStore store;
    private final Sleeper sleeper;
    private final AuthProperties.BruteForce config;

    public BruteForceGuard(BruteForceCounterStore store, Sleeper sleeper, AuthProperties authProperties) {
        this.store = store;
        this.sleeper = sleeper;
        this.config = authProperties.getBruteForce();
    }

    public void applyDelay(String email) {
        if (!config.isEnabled()) {
            return;
        }
        int attempts = store.get(key(email), config.getWindow());
        Duration delay = computeDelay(attempts);
        if (delay.isZero()) {
            return;
        }
        log.debug("Delaying login attempt for {} by {} ms after {} failures", email, delay.toMillis(), attempts);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Brute-force delay interrupted for {}", email);
        }
    }

    public BruteForceResult recordFailure(String email) {
        if (!config.isEnabled()) {
            return new BruteForceResult(0, false);
        }
        int attempts = store.increment(key(email), config.getWindow());
        return new BruteForceResult(attempts, attempts >= config.getCaptchaThreshold());
    }

    public void reset(String email) {
        if (!config.isEnabled()) {
            return;
        }
        store.delete(key(email));
    }

    Duration computeDelay(int attempts) {
        if (attempts <= 0) {
            return Duration.ZERO;
        }
        AuthProperties.ProgressiveDelays delays = config.getProgressiveDelays();
        Duration candidate = delays.getBase().plus(delays.getStep().multipliedBy(attempts - 1L));
        return candidate.compareTo(delays.getMax()) > 0 ? delays.getMax() : candidate;
    }

    private static String key(String email) {
        String normalized = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        return KEY_PREFIX + normalized;
    }

    public record BruteForceResult(int attempts, boolean captchaRequired) {
    }
}
