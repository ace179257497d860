package com.telemetry.infrastructure.persistence.entity;

import com.telemetry.domain.model.ArtifactKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per artifact-processing task.
 *
 * Status flow: PENDING -> PROCESSING -> DONE | PENDING (retry) | DLQ.
 * DONE and DLQ are terminal. {@code attempts} is incremented by the claim,
 * never by anything else.
 */
@Entity
@Table(name = "ingest_jobs", indexes = {
    @Index(name = "idx_ingest_jobs_status_next_run", columnList = "status,nextRunAt"),
    @Index(name = "idx_ingest_jobs_session", columnList = "sessionId"),
    @Index(name = "idx_ingest_jobs_artifact", columnList = "artifactId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Column(length = 64)
    private String sessionId;

    @Column(columnDefinition = "UUID")
    private UUID artifactId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ArtifactKind kind;

    @Column(columnDefinition = "TEXT")
    private String payloadRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int attempts;

    @Column
    private Instant nextRunAt;

    @Column(columnDefinition = "TEXT")
    private String errorMsg;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public enum JobStatus {
        PENDING,
        PROCESSING,
        DONE,
        FAILED,
        DLQ;

        public boolean isTerminal() {
            return this == DONE || this == DLQ;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
