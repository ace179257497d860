package com.telemetry.infrastructure.cache;

import com.telemetry.domain.model.TeamSessionLimit;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionLimitCacheServiceTest {

    private static final UUID TEAM_ID = UUID.fromString("1f0c8a52-0000-4000-8000-0000000000aa");

    @Mock
    private RedisCacheService cache;

    @Mock
    private SessionRepository sessionRepository;

    private SessionLimitCacheService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC);
        DistributedCacheLock cacheLock = new DistributedCacheLock(cache, 1, 3);
        service = new SessionLimitCacheService(cacheLock, cache, sessionRepository, clock, 5000, "pro");
    }

    @Test
    void testGetSessionLimit_LoadsCurrentMonthOnMiss() {
        // Given
        String key = "sessions:" + TEAM_ID + ":2026-03";
        when(cache.get(key, TeamSessionLimit.class)).thenReturn(Optional.empty());
        when(cache.tryLock(eq("session_lock:" + TEAM_ID + ":2026-03"), anyString(), eq(SessionLimitCacheService.LOCK_TTL)))
                .thenReturn(true);
        when(sessionRepository.countTeamSessionsBetween(TEAM_ID,
                Instant.parse("2026-03-01T00:00:00Z"), Instant.parse("2026-04-01T00:00:00Z")))
                .thenReturn(5000L);

        // When
        TeamSessionLimit limit = service.getSessionLimit(TEAM_ID);

        // Then
        assertEquals("2026-03", limit.getPeriod());
        assertEquals(5000L, limit.getSessionsUsed());
        assertEquals("pro", limit.getPlanName());
        assertTrue(limit.isExceeded());
        verify(cache).set(key, limit, SessionLimitCacheService.CACHE_TTL);
    }

    @Test
    void testGetSessionLimit_CachedSnapshotSkipsQuery() {
        // Given
        TeamSessionLimit cached = TeamSessionLimit.builder()
                .teamId(TEAM_ID).period("2026-03").sessionsUsed(10).sessionLimit(5000).planName("pro").build();
        when(cache.get("sessions:" + TEAM_ID + ":2026-03", TeamSessionLimit.class)).thenReturn(Optional.of(cached));

        // When
        TeamSessionLimit limit = service.getSessionLimit(TEAM_ID);

        // Then
        assertSame(cached, limit);
        assertFalse(limit.isExceeded());
        verifyNoInteractions(sessionRepository);
    }

    @Test
    void testInvalidate_DropsCurrentPeriod() {
        // When
        service.invalidate(TEAM_ID);

        // Then
        verify(cache).invalidate("sessions:" + TEAM_ID + ":2026-03");
    }
}
