package com.lumi.backend.modules.auth.infrastructure.bruteforce;

import java.time.Clock;

import com.lumi.backend.global.config.AuthProperties;
import com.lumi.backend.modules.auth.application.BruteForceCounterStore;
import com.lumi.backend.modules.auth.application.Sleeper;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class BruteForceStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "lumi.auth.brute-force.store", havingValue = "memory", matchIfMissing = true)
    public BruteForceCounterStore inMemoryBruteForceCounterStore(Clock clock, AuthProperties properties) {
        return new InMemoryBruteForceCounterStore(clock, properties.getBruteForce().getMaxTrackedKeys());
    }

    @Bean
    @ConditionalOnProperty(name = "lumi.auth.brute-force.store", havingValue = "redis")
    public BruteForceCounterStore redisBruteForceCounterStore(StringRedisTemplate redisTemplate, Clock clock,
                                                              AuthProperties properties) {
        return new RedisBruteForceCounterStore(redisTemplate,
                new InMemoryBruteForceCounterStore(clock, properties.getBruteForce().getMaxTrackedKeys()));
    }

    @Bean
    public Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
