package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.AppDailyStatsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.UUID;

@Repository
public interface AppDailyStatsRepository extends JpaRepository<AppDailyStatsEntity, UUID> {

    @Modifying
    @Query(value = "INSERT INTO app_daily_stats (id, project_id, date, total_crashes, total_anrs, total_errors) " +
           "VALUES (gen_random_uuid(), :projectId, :date, :crashes, :anrs, :errors) " +
           "ON CONFLICT (project_id, date) DO UPDATE SET " +
           "total_crashes = app_daily_stats.total_crashes + EXCLUDED.total_crashes, " +
           "total_anrs = app_daily_stats.total_anrs + EXCLUDED.total_anrs, " +
           "total_errors = app_daily_stats.total_errors + EXCLUDED.total_errors",
           nativeQuery = true)
    int increment(
            @Param("projectId") UUID projectId,
            @Param("date") LocalDate date,
            @Param("crashes") int crashes,
            @Param("anrs") int anrs,
            @Param("errors") int errors
    );
}
