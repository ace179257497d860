package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per-screen, per-day touch heatmap. Bucket maps are written only through the
 * additive merge in ScreenTouchHeatmapRepository.
 */
@Entity
@Table(name = "screen_touch_heatmaps", uniqueConstraints = {
    @UniqueConstraint(name = "uq_screen_touch_heatmaps", columnNames = {"project_id", "screen_name", "date"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreenTouchHeatmapEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Column(nullable = false)
    private String screenName;

    @Column(nullable = false)
    private LocalDate date;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private Map<String, Integer> touchBuckets = new HashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private Map<String, Integer> rageTapBuckets = new HashMap<>();

    private int totalTouches;

    private int totalRageTaps;

    @Column(length = 64)
    private String sampleSessionId;

    @Column
    private Long screenFirstSeenMs;

    @Column(nullable = false)
    private Instant updatedAt;
}
