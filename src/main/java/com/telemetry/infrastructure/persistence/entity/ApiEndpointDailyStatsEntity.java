package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Daily rollup per {@code "METHOD /path"} endpoint and region.
 */
@Entity
@Table(name = "api_endpoint_daily_stats", uniqueConstraints = {
    @UniqueConstraint(name = "uq_api_endpoint_daily_stats",
            columnNames = {"project_id", "date", "endpoint", "region"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiEndpointDailyStatsEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Column(nullable = false)
    private LocalDate date;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String endpoint;

    @Column(nullable = false, length = 50)
    private String region;

    private long totalCalls;

    private long totalErrors;

    private long sumLatencyMs;

    @Column(nullable = false)
    private Instant updatedAt;
}
