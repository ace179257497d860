package com.telemetry.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * JSON values and short-lived locks in Redis.
 *
 * Every call sits behind the {@code redis} circuit breaker. When Redis is
 * unavailable reads behave as misses, writes are skipped, and lock
 * acquisition reports success so callers load directly instead of waiting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisCacheService {

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(cached, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "setFallback")
    public void set(String key, Object value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
            log.debug("Cached key: {} (TTL: {}s)", key, ttl.toSeconds());
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize cache value for {}: {}", key, e.getOriginalMessage());
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateFallback")
    public void invalidate(String key) {
        redisTemplate.delete(key);
        log.debug("Invalidated cache for key: {}", key);
    }

    /**
     * Window counter: {@code INCR} plus a TTL set on first use. Returns the new value.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "incrementFallback")
    public long increment(String key, Duration ttl) {
        Long value = redisTemplate.opsForValue().increment(key);
        if (value != null && value == 1L) {
            redisTemplate.expire(key, ttl);
        }
        return value != null ? value : 0L;
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "counterFallback")
    public long counter(String key) {
        String value = redisTemplate.opsForValue().get(key);
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Counter {} holds a non-numeric value", key);
            return 0L;
        }
    }

    /**
     * {@code SET key token NX EX ttl}.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "tryLockFallback")
    public boolean tryLock(String lockKey, String token, Duration ttl) {
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, token, ttl);
        return Boolean.TRUE.equals(acquired);
    }

    /**
     * Release only if the lock still carries our token.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "releaseLockFallback")
    public void releaseLock(String lockKey, String token) {
        Long released = redisTemplate.execute(RELEASE_SCRIPT, List.of(lockKey), token);
        if (released == null || released == 0L) {
            log.debug("Lock {} expired or taken over before release", lockKey);
        }
    }

    public String key(String prefix, Object... parts) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object part : parts) {
            key.append(":").append(part != null ? part.toString() : "null");
        }
        return key.toString();
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<T> getFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis unavailable, treating {} as cache miss: {}", key, e.getMessage());
        return Optional.empty();
    }

    private void setFallback(String key, Object value, Duration ttl, Exception e) {
        log.warn("Redis unavailable, skipping cache write for {}", key);
    }

    private void invalidateFallback(String key, Exception e) {
        log.warn("Redis unavailable, skipping invalidation of {}", key);
    }

    private long incrementFallback(String key, Duration ttl, Exception e) {
        log.warn("Redis unavailable, counter {} not incremented", key);
        return 0L;
    }

    private long counterFallback(String key, Exception e) {
        log.warn("Redis unavailable, reading counter {} as 0", key);
        return 0L;
    }

    private boolean tryLockFallback(String lockKey, String token, Duration ttl, Exception e) {
        log.warn("Redis unavailable, proceeding without lock {}", lockKey);
        return true;
    }

    private void releaseLockFallback(String lockKey, String token, Exception e) {
        log.warn("Redis unavailable, lock {} left to expire", lockKey);
    }
}
