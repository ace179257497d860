package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Durable job ledger.
 *
 * Every state change is a single conditional UPDATE so two workers can never
 * both own a job.
 */
@Repository
public interface IngestJobRepository extends JpaRepository<IngestJobEntity, UUID> {

    /**
     * Jobs that are due: pending and either never scheduled or past their
     * backoff. Oldest first.
     */
    @Query("SELECT j FROM IngestJobEntity j WHERE j.status = :status " +
           "AND (j.nextRunAt IS NULL OR j.nextRunAt <= :now) " +
           "ORDER BY j.createdAt ASC")
    List<IngestJobEntity> findRunnable(
            @Param("status") JobStatus status,
            @Param("now") Instant now,
            Pageable pageable
    );

    /**
     * Claim a job. Returns 0 when another worker got there first.
     */
    @Modifying
    @Transactional
    @Query("UPDATE IngestJobEntity j SET j.status = :to, j.attempts = j.attempts + 1, j.updatedAt = :now " +
           "WHERE j.id = :id AND j.status = :from")
    int claim(
            @Param("id") UUID id,
            @Param("from") JobStatus from,
            @Param("to") JobStatus to,
            @Param("now") Instant now
    );

    @Modifying
    @Transactional
    @Query("UPDATE IngestJobEntity j SET j.status = com.telemetry.infrastructure.persistence.entity.IngestJobEntity.JobStatus.DONE, " +
           "j.errorMsg = NULL, j.updatedAt = :now WHERE j.id = :id")
    int markDone(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Transactional
    @Query("UPDATE IngestJobEntity j SET j.status = com.telemetry.infrastructure.persistence.entity.IngestJobEntity.JobStatus.PENDING, " +
           "j.errorMsg = :error, j.nextRunAt = :nextRunAt, j.updatedAt = :now WHERE j.id = :id")
    int scheduleRetry(
            @Param("id") UUID id,
            @Param("error") String error,
            @Param("nextRunAt") Instant nextRunAt,
            @Param("now") Instant now
    );

    @Modifying
    @Transactional
    @Query("UPDATE IngestJobEntity j SET j.status = com.telemetry.infrastructure.persistence.entity.IngestJobEntity.JobStatus.DLQ, " +
           "j.errorMsg = :error, j.updatedAt = :now WHERE j.id = :id")
    int moveToDlq(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);

    long countBySessionIdAndStatusIn(String sessionId, Collection<JobStatus> statuses);

    boolean existsByArtifactId(UUID artifactId);

    long countByStatus(JobStatus status);

    List<IngestJobEntity> findByStatusOrderByUpdatedAtDesc(JobStatus status, Pageable pageable);
}
