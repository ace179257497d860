package com.telemetry.domain.service;

import com.telemetry.domain.model.ArtifactKind;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.repository.ArtifactRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import com.telemetry.infrastructure.storage.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RetentionSweeper.
 */
@ExtendWith(MockitoExtension.class)
class RetentionSweeperTest {

    private static final UUID PROJECT_ID = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SessionRepository sessionRepository;

    @Mock
    private ArtifactRepository artifactRepository;

    @Mock
    private ArtifactStore artifactStore;

    private RetentionSweeper sweeper;

    @BeforeEach
    void setUp() {
        sweeper = new RetentionSweeper(sessionRepository, artifactRepository, artifactStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testSweep_DeletesArchivesOnRecordedEndpoint() {
        // Given an expired tier 1 session
        SessionEntity session = SessionEntity.builder()
                .id("session-1")
                .projectId(PROJECT_ID)
                .retentionTier(1)
                .startedAt(NOW.minus(Duration.ofDays(10)))
                .build();
        ArtifactEntity archive = artifact("tenant/t/project/p/sessions/session-1/screenshots/0001.tar.gz", "endpoint-b");
        ArtifactEntity stray = artifact("tenant/t/project/p/sessions/session-1/events/batch.json", "endpoint-b");

        when(sessionRepository.findExpiredRecordings(anyInt(), any(), anyInt())).thenReturn(List.of());
        when(sessionRepository.findExpiredRecordings(1, NOW.minus(Duration.ofDays(7)), 100)).thenReturn(List.of(session));
        when(artifactRepository.findBySessionIdInAndKind(List.of("session-1"), ArtifactKind.SCREENSHOTS))
                .thenReturn(List.of(archive, stray));
        when(artifactStore.delete(PROJECT_ID, archive.getObjectKey(), "endpoint-b")).thenReturn(true);

        // When
        int swept = sweeper.sweep();

        // Then
        assertEquals(1, swept);
        verify(artifactStore).delete(PROJECT_ID, archive.getObjectKey(), "endpoint-b");
        verify(artifactStore, never()).delete(any(), eq(stray.getObjectKey()), any());
        verify(artifactRepository).delete(archive);
        verify(artifactRepository, never()).delete(stray);
        verify(sessionRepository).markRecordingDeleted("session-1", NOW);
    }

    @Test
    void testSweep_FailedObjectDeleteKeepsRowForRetry() {
        // Given two archives, the second of which cannot be deleted
        SessionEntity session = SessionEntity.builder()
                .id("session-1")
                .projectId(PROJECT_ID)
                .retentionTier(1)
                .build();
        ArtifactEntity gone = artifact("tenant/t/project/p/sessions/session-1/screenshots/0001.tar.gz", "endpoint-b");
        ArtifactEntity stuck = artifact("tenant/t/project/p/sessions/session-1/screenshots/0002.tar.gz", "endpoint-b");

        when(sessionRepository.findExpiredRecordings(anyInt(), any(), anyInt())).thenReturn(List.of());
        when(sessionRepository.findExpiredRecordings(1, NOW.minus(Duration.ofDays(7)), 100)).thenReturn(List.of(session));
        when(artifactRepository.findBySessionIdInAndKind(List.of("session-1"), ArtifactKind.SCREENSHOTS))
                .thenReturn(List.of(gone, stuck));
        when(artifactStore.delete(PROJECT_ID, gone.getObjectKey(), "endpoint-b")).thenReturn(true);
        when(artifactStore.delete(PROJECT_ID, stuck.getObjectKey(), "endpoint-b")).thenReturn(false);

        // When
        int swept = sweeper.sweep();

        // Then
        assertEquals(0, swept);
        verify(artifactRepository).delete(gone);
        verify(artifactRepository, never()).delete(stuck);
        verify(sessionRepository, never()).markRecordingDeleted(any(), any());
    }

    @Test
    void testSweep_QueriesEveryFiniteTier() {
        // Given
        when(sessionRepository.findExpiredRecordings(anyInt(), any(), anyInt())).thenReturn(List.of());

        // When
        int swept = sweeper.sweep();

        // Then
        assertEquals(0, swept);
        verify(sessionRepository).findExpiredRecordings(1, NOW.minus(Duration.ofDays(7)), 100);
        verify(sessionRepository).findExpiredRecordings(2, NOW.minus(Duration.ofDays(30)), 100);
        verify(sessionRepository).findExpiredRecordings(3, NOW.minus(Duration.ofDays(90)), 100);
        verify(sessionRepository).findExpiredRecordings(4, NOW.minus(Duration.ofDays(365)), 100);
        verify(sessionRepository, never()).findExpiredRecordings(eq(5), any(), anyInt());
    }

    private static ArtifactEntity artifact(String key, String endpointId) {
        return ArtifactEntity.builder()
                .id(UUID.randomUUID())
                .sessionId("session-1")
                .kind(ArtifactKind.SCREENSHOTS)
                .objectKey(key)
                .endpointId(endpointId)
                .build();
    }
}
