package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "app_daily_stats", uniqueConstraints = {
    @UniqueConstraint(name = "uq_app_daily_stats", columnNames = {"project_id", "date"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppDailyStatsEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Column(nullable = false)
    private LocalDate date;

    private int totalCrashes;

    private int totalAnrs;

    private int totalErrors;
}
