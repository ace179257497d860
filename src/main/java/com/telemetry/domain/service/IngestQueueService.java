package com.telemetry.domain.service;

import com.telemetry.domain.model.QueueStatus;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity.JobStatus;
import com.telemetry.infrastructure.persistence.repository.IngestJobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view over the ingest queue for operators.
 */
@Service
@RequiredArgsConstructor
public class IngestQueueService {

    private final IngestJobRepository jobRepository;
    private final IngestWorker ingestWorker;
    private final Clock clock;

    public Optional<IngestJobEntity> getJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * Most recently dead-lettered jobs first.
     */
    public List<IngestJobEntity> deadLetters(int limit) {
        return jobRepository.findByStatusOrderByUpdatedAtDesc(JobStatus.DLQ, PageRequest.of(0, limit));
    }

    public QueueStatus queueStatus() {
        return QueueStatus.builder()
                .pending(jobRepository.countByStatus(JobStatus.PENDING))
                .processing(jobRepository.countByStatus(JobStatus.PROCESSING))
                .done(jobRepository.countByStatus(JobStatus.DONE))
                .dlq(jobRepository.countByStatus(JobStatus.DLQ))
                .workerRunning(ingestWorker.isRunning())
                .checkedAt(clock.instant())
                .build();
    }
}
