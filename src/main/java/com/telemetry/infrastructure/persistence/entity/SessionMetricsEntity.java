package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Running aggregates for one session.
 *
 * Counters are only ever changed with {@code SET c = c + :delta} statements
 * (see SessionMetricsRepository). The entity is written back only for the
 * derived columns (scores, screen path) while the row lock is held.
 */
@Entity
@Table(name = "session_metrics")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetricsEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, unique = true, length = 64)
    private String sessionId;

    private int touchCount;
    private int scrollCount;
    private int gestureCount;
    private int inputCount;
    private int customEventCount;
    private int rageTapCount;
    private int deadTapCount;
    private int errorCount;
    private int crashCount;
    private int anrCount;

    private int apiTotalCount;
    private int apiSuccessCount;
    private int apiErrorCount;

    /**
     * Weighted running average over {@link #apiLatencySampleCount} samples.
     */
    private double apiAvgResponseMs;
    private long apiLatencySampleCount;

    private double uxScore;
    private double interactionScore;
    private double explorationScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private List<String> screensVisited = new ArrayList<>();

    private long eventsSizeBytes;

    @Column
    private Double appStartupTimeMs;

    @Column(length = 20)
    private String networkType;

    @Column(length = 10)
    private String cellularGeneration;

    @Column(name = "is_constrained")
    private boolean constrained;

    @Column(name = "is_expensive")
    private boolean expensive;

    private int screenshotSegmentCount;
    private long screenshotTotalBytes;
    private int hierarchySnapshotCount;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
