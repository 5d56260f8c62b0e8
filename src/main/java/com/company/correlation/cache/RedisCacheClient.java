package com.company.correlation.cache;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Every call goes through the {@code groupSnapshotCache} circuit breaker, so an unhealthy Redis
 * fails fast with {@code CallNotPermittedException} instead of waiting out the command timeout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisCacheClient implements CacheClient {

    static final String CIRCUIT_BREAKER = "groupSnapshotCache";

    private final RedisTemplate<String, byte[]> snapshotRedisTemplate;

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER)
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(snapshotRedisTemplate.opsForValue().get(key));
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER)
    public void set(String key, byte[] value, Duration ttl) {
        snapshotRedisTemplate.opsForValue().set(key, value, ttl);
        log.debug("Cached {} ({} bytes, ttl {})", key, value.length, ttl);
    }

    @Override
    @CircuitBreaker(name = CIRCUIT_BREAKER)
    public void delete(String key) {
        snapshotRedisTemplate.delete(key);
    }
}
