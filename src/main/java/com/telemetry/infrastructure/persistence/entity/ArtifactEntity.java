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
 * Uploaded blob belonging to one session.
 *
 * {@code endpointId} is recorded at upload time and never changes; it is the
 * only reliable way to find the object again when several storage endpoints
 * share the load.
 */
@Entity
@Table(name = "recording_artifacts", indexes = {
    @Index(name = "idx_artifacts_session", columnList = "sessionId"),
    @Index(name = "idx_artifacts_session_kind", columnList = "sessionId,kind")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 64)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ArtifactKind kind;

    @Column(name = "s3_object_key", nullable = false, columnDefinition = "TEXT")
    private String objectKey;

    @Column(length = 64, updatable = false)
    private String endpointId;

    @Column
    private Long sizeBytes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ArtifactStatus status = ArtifactStatus.PENDING;

    // Segment bounds in epoch millis, screenshots only
    @Column
    private Long startTime;

    @Column
    private Long endTime;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant readyAt;

    public enum ArtifactStatus {
        PENDING,
        READY
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
