package com.telemetry.domain.service;

import com.telemetry.domain.model.ArtifactKind;
import com.telemetry.domain.service.ArtifactJobProcessor.JobOutcome;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity.JobStatus;
import com.telemetry.infrastructure.persistence.repository.IngestJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IngestWorker.
 *
 * Runs against a real two-thread pool; the processor and repository are mocked.
 */
@ExtendWith(MockitoExtension.class)
class IngestWorkerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private IngestJobRepository jobRepository;

    @Mock
    private ArtifactJobProcessor processor;

    private ExecutorService executor;
    private IngestWorker worker;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        worker = new IngestWorker(jobRepository, processor, executor, Clock.fixed(NOW, ZoneOffset.UTC), 2, 20);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testPollOnce_OneJobPerSession() {
        // Given
        IngestJobEntity first = job("session-1");
        IngestJobEntity second = job("session-1");
        IngestJobEntity other = job("session-2");
        IngestJobEntity orphanA = job(null);
        IngestJobEntity orphanB = job(null);
        when(jobRepository.findRunnable(eq(JobStatus.PENDING), eq(NOW), any(Pageable.class)))
                .thenReturn(List.of(first, second, other, orphanA, orphanB));
        when(processor.process(any())).thenReturn(JobOutcome.DONE);

        // When
        int processed = worker.pollOnce();

        // Then
        assertEquals(4, processed);
        verify(processor).process(first);
        verify(processor, never()).process(second);
        verify(processor).process(other);
        verify(processor).process(orphanA);
        verify(processor).process(orphanB);
        assertEquals(NOW, worker.getLastPollAt());
    }

    @Test
    void testPollOnce_FailingJobDoesNotStopBatch() {
        // Given
        IngestJobEntity bad = job("session-1");
        IngestJobEntity good = job("session-2");
        when(jobRepository.findRunnable(eq(JobStatus.PENDING), eq(NOW), any(Pageable.class)))
                .thenReturn(List.of(bad, good));
        when(processor.process(bad)).thenThrow(new IllegalStateException("unexpected"));
        when(processor.process(good)).thenReturn(JobOutcome.DONE);

        // When
        int processed = worker.pollOnce();

        // Then
        assertEquals(2, processed);
        verify(processor).process(good);
    }

    @Test
    void testPollOnce_EmptyQueue() {
        // Given
        when(jobRepository.findRunnable(eq(JobStatus.PENDING), eq(NOW), any(Pageable.class))).thenReturn(List.of());

        // When / Then
        assertEquals(0, worker.pollOnce());
        verifyNoInteractions(processor);
    }

    @Test
    void testStop_NoMorePolling() {
        // When
        worker.stop();
        worker.poll();

        // Then
        assertFalse(worker.isRunning());
        assertTrue(executor.isShutdown());
        verifyNoInteractions(jobRepository);
    }

    @Test
    void testOnePerSession_KeepsFetchOrder() {
        // Given
        IngestJobEntity a = job("a");
        IngestJobEntity b = job("b");
        IngestJobEntity a2 = job("a");

        // When
        List<IngestJobEntity> batch = IngestWorker.onePerSession(List.of(b, a, a2));

        // Then
        assertEquals(List.of(b, a), batch);
    }

    private static IngestJobEntity job(String sessionId) {
        return IngestJobEntity.builder()
                .id(UUID.randomUUID())
                .projectId(UUID.randomUUID())
                .sessionId(sessionId)
                .kind(ArtifactKind.EVENTS)
                .payloadRef("key")
                .build();
    }
}
