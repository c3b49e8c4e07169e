package com.lumi.backend.modules.auth.infrastructure.bruteforce;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import com.lumi.backend.modules.auth.application.BruteForceCounterStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisBruteForceCounterStoreTest {

    private static final Duration WINDOW = Duration.ofMinutes(15);
    private static final String KEY = "lumi:auth:brute-force:jamie@example.com";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private BruteForceCounterStore fallback;

    private RedisBruteForceCounterStore store;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        store = new RedisBruteForceCounterStore(redisTemplate, fallback);
    }

    @Test
    void firstIncrementSetsExpiry() {
        when(valueOperations.increment(KEY)).thenReturn(1L);

        assertThat(store.increment(KEY, WINDOW)).isEqualTo(1);

        verify(redisTemplate).expire(KEY, WINDOW);
    }

    @Test
    void laterIncrementsKeepExistingExpiry() {
        when(valueOperations.increment(KEY)).thenReturn(4L);

        assertThat(store.increment(KEY, WINDOW)).isEqualTo(4);

        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void fallsBackToMemoryWhenRedisIsDown() {
        when(valueOperations.increment(KEY)).thenThrow(new RedisConnectionFailureException("down"));
        when(fallback.increment(KEY, WINDOW)).thenReturn(2);

        assertThat(store.increment(KEY, WINDOW)).isEqualTo(2);
    }

    @Test
    void readsCounterAndFallsBackOnFailure() {
        when(valueOperations.get(KEY)).thenReturn("3").thenThrow(new RedisConnectionFailureException("down"));
        when(fallback.get(eq(KEY), eq(WINDOW))).thenReturn(1);

        assertThat(store.get(KEY, WINDOW)).isEqualTo(3);
        assertThat(store.get(KEY, WINDOW)).isEqualTo(1);
    }

    @Test
    void missingOrGarbledCounterReadsAsZero() {
        when(valueOperations.get(KEY)).thenReturn(null).thenReturn("oops");

        assertThat(store.get(KEY, WINDOW)).isZero();
        assertThat(store.get(KEY, WINDOW)).isZero();
    }

    @Test
    void deleteClearsBothStoresEvenWhenRedisFails() {
        when(redisTemplate.delete(KEY)).thenThrow(new RedisConnectionFailureException("down"));

        store.delete(KEY);

        verify(fallback).delete(KEY);
    }
}
