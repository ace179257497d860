package com.telemetry.infrastructure.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Cache-aside read where only one caller refreshes a missing entry.
 *
 * On a miss the caller takes {@code lockKey} with SET NX EX. The holder
 * re-checks the cache, loads, populates and releases. Everyone else waits
 * and re-reads, up to {@code maxRetries} times, then loads without caching.
 * A null load result is returned but never cached.
 */
@Slf4j
@Component
public class DistributedCacheLock {

    private final RedisCacheService cache;
    private final Duration waitInterval;
    private final int maxRetries;

    public DistributedCacheLock(RedisCacheService cache,
                                @Value("${cache.lock.wait-ms:100}") long waitMs,
                                @Value("${cache.lock.max-retries:3}") int maxRetries) {
        this.cache = cache;
        this.waitInterval = Duration.ofMillis(waitMs);
        this.maxRetries = maxRetries;
    }

    public <T> T getOrLoad(String cacheKey, String lockKey, Class<T> type,
                           Duration ttl, Duration lockTtl, Supplier<T> loader) {
        String token = UUID.randomUUID().toString();

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            Optional<T> cached = cache.get(cacheKey, type);
            if (cached.isPresent()) {
                return cached.get();
            }

            if (cache.tryLock(lockKey, token, lockTtl)) {
                try {
                    Optional<T> rechecked = cache.get(cacheKey, type);
                    if (rechecked.isPresent()) {
                        return rechecked.get();
                    }
                    T value = loader.get();
                    if (value != null) {
                        cache.set(cacheKey, value, ttl);
                    }
                    return value;
                } finally {
                    cache.releaseLock(lockKey, token);
                }
            }

            if (attempt < maxRetries && !pause()) {
                break;
            }
        }

        log.warn("Lock contention on {}, loading without cache", lockKey);
        return loader.get();
    }

    private boolean pause() {
        try {
            Thread.sleep(waitInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
