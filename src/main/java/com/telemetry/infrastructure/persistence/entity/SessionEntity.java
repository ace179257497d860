package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Recorded app session.
 *
 * Once {@code endedAt} is set the session is closed. Later artifacts may still
 * add metrics or push {@code endedAt} forward, never backward.
 */
@Entity
@Table(name = "sessions", indexes = {
    @Index(name = "idx_sessions_project_started", columnList = "projectId,startedAt"),
    @Index(name = "idx_sessions_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Column(length = 255)
    private String deviceId;

    @Column(length = 20)
    private String platform;

    @Column(length = 50)
    private String appVersion;

    @Column(length = 100)
    private String deviceModel;

    @Column(columnDefinition = "TEXT")
    private String osVersion;

    @Column(length = 255)
    private String userDisplayId;

    @Column(length = 255)
    private String anonymousDisplayId;

    @Column(nullable = false)
    private Instant startedAt;

    @Column
    private Instant endedAt;

    @Column
    private Integer durationSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SessionStatus status = SessionStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private int retentionTier = 1;

    @Column(nullable = false)
    private int replaySegmentCount;

    @Column(nullable = false)
    private long replayStorageBytes;

    @Column(nullable = false)
    private boolean replayPromoted;

    @Column(length = 50)
    private String replayPromotedReason;

    @Column
    private Instant replayPromotedAt;

    @Column
    private Double replayPromotionScore;

    @Column(nullable = false)
    private boolean recordingDeleted;

    @Column
    private Instant recordingDeletedAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public enum SessionStatus {
        PENDING,
        PROCESSING,
        READY,
        FAILED,
        DELETED
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (startedAt == null) {
            startedAt = now;
        }
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }
}
