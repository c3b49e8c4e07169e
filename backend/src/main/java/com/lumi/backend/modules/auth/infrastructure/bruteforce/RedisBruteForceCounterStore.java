package com.lumi.backend.modules.auth.infrastructure.bruteforce;

import java.time.Duration;

import com.lumi.backend.modules.auth.application.BruteForceCounterStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Shared counters in Redis ({@code INCR}, with {@code EXPIRE} set on the first hit of a window).
 * When Redis is unreachable the in-memory fallback keeps the guard working on this node.
 */
public class RedisBruteForceCounterStore implements BruteForceCounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisBruteForceCounterStore.class);

    private final StringRedisTemplate redisTemplate;
    private final BruteForceCounterStore fallback;

    public RedisBruteForceCounterStore(StringRedisTemplate redisTemplate, BruteForceCounterStore fallback) {
        this.redisTemplate = redisTemplate;
        this.fallback = fallback;
    }

    @Override
    public int increment(String key, Duration window) {
        try {
            Long attempts = redisTemplate.opsForValue().increment(key);
            if (attempts == null) {
                return fallback.increment(key, window);
            }
            if (attempts == 1L) {
                redisTemplate.expire(key, window);
            }
            return Math.toIntExact(attempts);
        } catch (DataAccessException ex) {
            log.error("Redis brute-force increment failed for {}; using in-memory counter", key, ex);
            return fallback.increment(key, window);
        }
    }

    @Override
    public int get(String key, Duration window) {
        try {
            String value = redisTemplate.opsForValue().get(key);
            if (value == null) {
                return 0;
            }
            return Integer.parseInt(value);
        } catch (DataAccessException ex) {
            log.error("Redis brute-force lookup failed for {}; using in-memory counter", key, ex);
            return fallback.get(key, window);
        } catch (NumberFormatException ex) {
            log.warn("Ignoring non-numeric brute-force counter at {}", key);
            return 0;
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException ex) {
            log.error("Redis brute-force reset failed for {}", key, ex);
        }
        fallback.delete(key);
    }
}
