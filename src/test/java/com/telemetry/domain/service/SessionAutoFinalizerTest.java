package com.telemetry.domain.service;

import com.telemetry.domain.model.ArtifactKind;
import com.telemetry.domain.model.DeviceUsageDelta;
import com.telemetry.domain.model.PromotionResult;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity.ArtifactStatus;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.repository.ArtifactRepository;
import com.telemetry.infrastructure.persistence.repository.IngestJobRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SessionAutoFinalizer.
 *
 * A session idle for longer than the threshold is closed at its last
 * artifact, billed once and evaluated for replay once.
 */
@ExtendWith(MockitoExtension.class)
class SessionAutoFinalizerTest {

    private static final UUID PROJECT_ID = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SessionRepository sessionRepository;

    @Mock
    private ArtifactRepository artifactRepository;

    @Mock
    private IngestJobRepository jobRepository;

    @Mock
    private DeviceUsageService deviceUsageService;

    @Mock
    private PromotionEvaluator promotionEvaluator;

    @Mock
    private IngestWorker ingestWorker;

    private SessionAutoFinalizer finalizer;

    @BeforeEach
    void setUp() {
        finalizer = new SessionAutoFinalizer(sessionRepository, artifactRepository, jobRepository,
                deviceUsageService, promotionEvaluator, ingestWorker, Clock.fixed(NOW, ZoneOffset.UTC), 60_000);
    }

    @Test
    void testFinalizeIdleSessions_ClosesAtLastArtifact() {
        // Given a session started five minutes ago whose last artifact arrived 90s ago
        SessionEntity session = session("session-1", "device-1");
        Instant lastArtifactAt = NOW.minusSeconds(90);
        ArtifactEntity orphan = ArtifactEntity.builder()
                .id(UUID.randomUUID())
                .sessionId("session-1")
                .kind(ArtifactKind.SCREENSHOTS)
                .objectKey("tenant/t/project/p/sessions/session-1/screenshots/1.tar.gz")
                .build();

        when(ingestWorker.isRunning()).thenReturn(true);
        when(sessionRepository.findAutoFinalizeCandidates(NOW.minusSeconds(10), NOW.minusSeconds(60), 100))
                .thenReturn(List.of(session));
        when(artifactRepository.findLastCreatedAt("session-1")).thenReturn(lastArtifactAt);
        when(sessionRepository.closeIfOpen("session-1", lastArtifactAt, 210, NOW)).thenReturn(1);
        when(artifactRepository.findBySessionIdAndStatus("session-1", ArtifactStatus.PENDING)).thenReturn(List.of(orphan));
        when(jobRepository.existsByArtifactId(orphan.getId())).thenReturn(false);
        when(promotionEvaluator.evaluate("session-1", PROJECT_ID, 210)).thenReturn(PromotionResult.rejected("not_promoted"));

        // When
        int closed = finalizer.finalizeIdleSessions();

        // Then
        assertEquals(1, closed);
        verify(deviceUsageService).record("device-1", PROJECT_ID, new DeviceUsageDelta(1, 4));
        verify(artifactRepository).markReady(orphan.getId(), NOW);

        ArgumentCaptor<IngestJobEntity> queued = ArgumentCaptor.forClass(IngestJobEntity.class);
        verify(jobRepository).save(queued.capture());
        assertEquals(orphan.getId(), queued.getValue().getArtifactId());
        assertEquals(ArtifactKind.SCREENSHOTS, queued.getValue().getKind());
        assertEquals(orphan.getObjectKey(), queued.getValue().getPayloadRef());
        assertEquals(IngestJobEntity.JobStatus.PENDING, queued.getValue().getStatus());

        verify(promotionEvaluator).evaluate("session-1", PROJECT_ID, 210);

        InOrder order = inOrder(jobRepository, sessionRepository);
        order.verify(jobRepository).save(any(IngestJobEntity.class));
        order.verify(sessionRepository).closeIfOpen("session-1", lastArtifactAt, 210, NOW);
    }

    @Test
    void testFinalizeIdleSessions_RecoveryFailureLeavesSessionOpen() {
        // Given a candidate whose pending artifacts cannot be read
        SessionEntity session = session("session-1", "device-1");
        when(ingestWorker.isRunning()).thenReturn(true);
        when(sessionRepository.findAutoFinalizeCandidates(any(), any(), anyInt())).thenReturn(List.of(session));
        when(artifactRepository.findLastCreatedAt("session-1")).thenReturn(NOW.minusSeconds(90));
        when(artifactRepository.findBySessionIdAndStatus("session-1", ArtifactStatus.PENDING))
                .thenThrow(new IllegalStateException("connection reset"));

        // When
        int closed = finalizer.finalizeIdleSessions();

        // Then: still open, so the next run picks it up again
        assertEquals(0, closed);
        verify(sessionRepository, never()).closeIfOpen(any(), any(), anyInt(), any());
        verifyNoInteractions(deviceUsageService, promotionEvaluator);
    }

    @Test
    void testFinalizeIdleSessions_UsageFailureStillEvaluatesPromotion() {
        // Given
        SessionEntity session = session("session-1", "device-1");
        when(ingestWorker.isRunning()).thenReturn(true);
        when(sessionRepository.findAutoFinalizeCandidates(any(), any(), anyInt())).thenReturn(List.of(session));
        when(artifactRepository.findLastCreatedAt("session-1")).thenReturn(NOW.minusSeconds(90));
        when(sessionRepository.closeIfOpen(eq("session-1"), any(), anyInt(), any())).thenReturn(1);
        doThrow(new IllegalStateException("usage table locked"))
                .when(deviceUsageService).record(eq("device-1"), eq(PROJECT_ID), any());
        when(promotionEvaluator.evaluate("session-1", PROJECT_ID, 210)).thenReturn(PromotionResult.rejected("not_promoted"));

        // When
        int closed = finalizer.finalizeIdleSessions();

        // Then
        assertEquals(1, closed);
        verify(promotionEvaluator).evaluate("session-1", PROJECT_ID, 210);
    }

    @Test
    void testFinalizeIdleSessions_AlreadyClosedIsLeftAlone() {
        // Given the same candidate, closed by someone else in the meantime
        SessionEntity session = session("session-1", "device-1");
        when(ingestWorker.isRunning()).thenReturn(true);
        when(sessionRepository.findAutoFinalizeCandidates(any(), any(), anyInt())).thenReturn(List.of(session));
        when(artifactRepository.findLastCreatedAt("session-1")).thenReturn(NOW.minusSeconds(90));
        when(sessionRepository.closeIfOpen(eq("session-1"), any(), anyInt(), any())).thenReturn(0);

        // When
        int closed = finalizer.finalizeIdleSessions();

        // Then
        assertEquals(0, closed);
        verifyNoInteractions(deviceUsageService, promotionEvaluator);
        verify(jobRepository, never()).save(any());
    }

    @Test
    void testFinalizeIdleSessions_OneFailureDoesNotStopOthers() {
        // Given
        SessionEntity broken = session("broken", null);
        SessionEntity fine = session("fine", null);
        when(ingestWorker.isRunning()).thenReturn(true);
        when(sessionRepository.findAutoFinalizeCandidates(any(), any(), anyInt())).thenReturn(List.of(broken, fine));
        when(artifactRepository.findLastCreatedAt("broken")).thenThrow(new IllegalStateException("db hiccup"));
        when(artifactRepository.findLastCreatedAt("fine")).thenReturn(NOW.minusSeconds(120));
        when(sessionRepository.closeIfOpen(eq("fine"), any(), anyInt(), any())).thenReturn(1);
        when(promotionEvaluator.evaluate(eq("fine"), any(), anyInt())).thenReturn(PromotionResult.rejected("no_recording_data"));

        // When
        int closed = finalizer.finalizeIdleSessions();

        // Then: no device id means no usage row
        assertEquals(1, closed);
        verifyNoInteractions(deviceUsageService);
    }

    @Test
    void testFinalizeIdleSessions_StopsWhenWorkerStopped() {
        // Given
        when(ingestWorker.isRunning()).thenReturn(false);
        when(sessionRepository.findAutoFinalizeCandidates(any(), any(), anyInt()))
                .thenReturn(List.of(session("session-1", "device-1")));

        // When
        int closed = finalizer.finalizeIdleSessions();

        // Then
        assertEquals(0, closed);
        verifyNoInteractions(artifactRepository);
    }

    @Test
    void testDurationSeconds_RoundedAndAtLeastOne() {
        assertEquals(1, SessionAutoFinalizer.durationSeconds(NOW, NOW));
        assertEquals(1, SessionAutoFinalizer.durationSeconds(NOW, NOW.plusMillis(1400)));
        assertEquals(3, SessionAutoFinalizer.durationSeconds(NOW, NOW.plusMillis(2600)));
        assertEquals(1, SessionAutoFinalizer.durationSeconds(NOW, NOW.minusSeconds(5)));
    }

    private static SessionEntity session(String id, String deviceId) {
        return SessionEntity.builder()
                .id(id)
                .projectId(PROJECT_ID)
                .deviceId(deviceId)
                .startedAt(NOW.minusSeconds(300))
                .build();
    }
}
