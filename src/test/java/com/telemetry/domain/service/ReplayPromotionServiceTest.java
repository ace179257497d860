package com.telemetry.domain.service;

import com.telemetry.domain.model.FlowProfile;
import com.telemetry.domain.model.PromotionResult;
import com.telemetry.infrastructure.cache.RedisCacheService;
import com.telemetry.infrastructure.persistence.entity.ProjectEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.entity.SessionMetricsEntity;
import com.telemetry.infrastructure.persistence.repository.ProjectRepository;
import com.telemetry.infrastructure.persistence.repository.SessionMetricsRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReplayPromotionService.
 *
 * Walks the decision order: preconditions, hard thresholds, flow-based
 * reasons, score and sampling, plus the per-reason rate limit.
 */
@ExtendWith(MockitoExtension.class)
class ReplayPromotionServiceTest {

    private static final String SESSION_ID = "session-1";
    private static final UUID PROJECT_ID = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SessionRepository sessionRepository;

    @Mock
    private SessionMetricsRepository metricsRepository;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private FunnelAnalysisService funnelAnalysis;

    @Mock
    private RedisCacheService cache;

    private double draw = 0.99;
    private ReplayPromotionService service;
    private SessionMetricsEntity metrics;

    @BeforeEach
    void setUp() {
        service = new ReplayPromotionService(sessionRepository, metricsRepository, projectRepository,
                funnelAnalysis, cache, () -> draw, Clock.fixed(NOW, ZoneOffset.UTC));

        metrics = new SessionMetricsEntity();
        metrics.setSessionId(SESSION_ID);
        metrics.setScreenshotSegmentCount(2);
        metrics.setTouchCount(10);
        metrics.setScreensVisited(new ArrayList<>(List.of("Home", "Cart")));
    }

    @Test
    void testEvaluate_CrashPromotes() {
        // Given
        givenSession();
        metrics.setCrashCount(1);

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertTrue(result.isPromoted());
        assertEquals("crash", result.getReason());
        verify(sessionRepository).markPromoted(SESSION_ID, "crash", 0.0, NOW);
        verify(cache).increment(any(), any());
    }

    @Test
    void testEvaluate_RateLimitedReason() {
        // Given
        givenSession();
        metrics.setCrashCount(1);
        when(cache.counter(any())).thenReturn(100L);

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertFalse(result.isPromoted());
        assertEquals("rate_limited", result.getReason());
        verify(cache, never()).increment(any(), any());
        verify(sessionRepository, never()).markPromoted(any(), any(), anyDouble(), any());
    }

    @Test
    void testEvaluate_HealthySessionNotPromoted() {
        // Given
        givenSession();

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertFalse(result.isPromoted());
        assertEquals("not_promoted", result.getReason());
        verify(sessionRepository).updatePromotionScore(eq(SESSION_ID), anyDouble(), eq(NOW));
    }

    @Test
    void testEvaluate_HealthySessionSampled() {
        // Given
        givenSession();
        draw = 0.01;

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertTrue(result.isPromoted());
        assertEquals("sample", result.getReason());
    }

    @Test
    void testEvaluate_StuckOnEntryScreen() {
        // Given
        givenSession();
        metrics.setScreensVisited(new ArrayList<>(List.of("Home")));
        when(funnelAnalysis.getFlowProfile(PROJECT_ID)).thenReturn(Optional.of(FlowProfile.builder()
                .entryScreens(new ArrayList<>(List.of("Home", "Login")))
                .build()));

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 45);

        // Then
        assertTrue(result.isPromoted());
        assertEquals("stuck_first_screen", result.getReason());
    }

    @Test
    void testEvaluate_DroppedOutOfFunnel() {
        // Given
        givenSession();
        metrics.setScreensVisited(new ArrayList<>(List.of("Home", "Search", "Detail")));
        when(funnelAnalysis.getLearnedFunnel(PROJECT_ID)).thenReturn(Optional.of(FlowProfile.builder()
                .dominantPath(new ArrayList<>(List.of("Home", "Search", "Cart", "Checkout")))
                .build()));

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertEquals("failed_funnel", result.getReason());
    }

    @Test
    void testEvaluate_SessionMissing() {
        // Given
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.empty());

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertEquals("session_not_found", result.getReason());
        verifyNoInteractions(metricsRepository, cache);
    }

    @Test
    void testEvaluate_AlreadyPromotedKeepsDecision() {
        // Given
        SessionEntity session = session();
        session.setReplayPromoted(true);
        session.setReplayPromotedReason("anr");
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session));

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertTrue(result.isPromoted());
        assertEquals("anr", result.getReason());
        verify(sessionRepository, never()).markPromoted(any(), any(), anyDouble(), any());
    }

    @Test
    void testEvaluate_NoScreenshotsNoReplay() {
        // Given
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session()));
        metrics.setScreenshotSegmentCount(0);
        metrics.setCrashCount(1);
        when(metricsRepository.findBySessionId(SESSION_ID)).thenReturn(Optional.of(metrics));

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertEquals("no_recording_data", result.getReason());
    }

    @Test
    void testEvaluate_RecordingDisabled() {
        // Given
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session()));
        when(metricsRepository.findBySessionId(SESSION_ID)).thenReturn(Optional.of(metrics));
        when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(ProjectEntity.builder()
                .id(PROJECT_ID)
                .recordingEnabled(false)
                .build()));

        // When
        PromotionResult result = service.evaluate(SESSION_ID, PROJECT_ID, 30);

        // Then
        assertEquals("recording_disabled", result.getReason());
    }

    @Test
    void testDroppedOutOfFunnel() {
        List<String> happy = List.of("Home", "Search", "Cart", "Checkout");
        assertTrue(ReplayPromotionService.droppedOutOfFunnel(List.of("Home", "Search", "Cart"), happy));
        assertFalse(ReplayPromotionService.droppedOutOfFunnel(List.of("Home", "Search", "Cart", "Checkout"), happy));
        assertFalse(ReplayPromotionService.droppedOutOfFunnel(List.of("Settings", "Search"), happy));
        assertFalse(ReplayPromotionService.droppedOutOfFunnel(List.of("Home"), happy));
        assertFalse(ReplayPromotionService.droppedOutOfFunnel(List.of("Home", "Search"), List.of()));
    }

    private void givenSession() {
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Optional.of(session()));
        when(metricsRepository.findBySessionId(SESSION_ID)).thenReturn(Optional.of(metrics));
        when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(ProjectEntity.builder()
                .id(PROJECT_ID)
                .teamId(UUID.randomUUID())
                .name("shop")
                .build()));
    }

    private static SessionEntity session() {
        return SessionEntity.builder()
                .id(SESSION_ID)
                .projectId(PROJECT_ID)
                .startedAt(NOW.minusSeconds(60))
                .build();
    }
}
