package com.telemetry.infrastructure.cache;

import com.telemetry.domain.model.TeamSessionLimit;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Team session usage per billing period, cached behind the distributed lock
 * so a burst of cache misses triggers a single count query.
 */
@Slf4j
@Service
public class SessionLimitCacheService {

    static final Duration CACHE_TTL = Duration.ofSeconds(300);
    static final Duration LOCK_TTL = Duration.ofSeconds(10);

    private final DistributedCacheLock cacheLock;
    private final RedisCacheService cache;
    private final SessionRepository sessionRepository;
    private final Clock clock;
    private final long defaultSessionLimit;
    private final String planName;

    public SessionLimitCacheService(DistributedCacheLock cacheLock,
                                    RedisCacheService cache,
                                    SessionRepository sessionRepository,
                                    Clock clock,
                                    @Value("${ingest.quota.default-session-limit:0}") long defaultSessionLimit,
                                    @Value("${ingest.quota.plan-name:default}") String planName) {
        this.cacheLock = cacheLock;
        this.cache = cache;
        this.sessionRepository = sessionRepository;
        this.clock = clock;
        this.defaultSessionLimit = defaultSessionLimit;
        this.planName = planName;
    }

    public TeamSessionLimit getSessionLimit(UUID teamId) {
        return getSessionLimit(teamId, currentPeriod());
    }

    public TeamSessionLimit getSessionLimit(UUID teamId, String period) {
        return cacheLock.getOrLoad(
                cacheKey(teamId, period),
                lockKey(teamId, period),
                TeamSessionLimit.class,
                CACHE_TTL,
                LOCK_TTL,
                () -> load(teamId, period));
    }

    /**
     * Drop the cached snapshot, e.g. after a session was created outside the
     * normal ingest path.
     */
    public void invalidate(UUID teamId) {
        cache.invalidate(cacheKey(teamId, currentPeriod()));
    }

    String currentPeriod() {
        return YearMonth.now(clock.withZone(ZoneOffset.UTC)).toString();
    }

    static String cacheKey(UUID teamId, String period) {
        return "sessions:" + teamId + ":" + period;
    }

    static String lockKey(UUID teamId, String period) {
        return "session_lock:" + teamId + ":" + period;
    }

    private TeamSessionLimit load(UUID teamId, String period) {
        YearMonth month = YearMonth.parse(period);
        Instant from = month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = month.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        long used = sessionRepository.countTeamSessionsBetween(teamId, from, to);
        log.debug("Loaded session usage for team {} period {}: {}", teamId, period, used);

        return TeamSessionLimit.builder()
                .teamId(teamId)
                .period(period)
                .sessionsUsed(used)
                .sessionLimit(defaultSessionLimit)
                .planName(planName)
                .build();
    }
}
