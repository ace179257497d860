package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-mostly project settings used by the ingest pipeline.
 */
@Entity
@Table(name = "projects")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID teamId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private boolean recordingEnabled = true;

    @Column(nullable = false)
    @Builder.Default
    private int maxRecordingMinutes = 10;

    // Sample rate for promoting replays of sessions without any issue signal
    @Column(nullable = false)
    @Builder.Default
    private double healthyReplaysPromoted = 0.05;

    @Column
    private Instant deletedAt;
}
