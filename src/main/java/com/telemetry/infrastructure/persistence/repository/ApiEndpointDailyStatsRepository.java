package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.ApiEndpointDailyStatsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.UUID;

@Repository
public interface ApiEndpointDailyStatsRepository extends JpaRepository<ApiEndpointDailyStatsEntity, UUID> {

    @Modifying
    @Query(value = "INSERT INTO api_endpoint_daily_stats " +
           "(id, project_id, date, endpoint, region, total_calls, total_errors, sum_latency_ms, updated_at) " +
           "VALUES (gen_random_uuid(), :projectId, :date, :endpoint, :region, :calls, :errors, :latencyMs, now()) " +
           "ON CONFLICT (project_id, date, endpoint, region) DO UPDATE SET " +
           "total_calls = api_endpoint_daily_stats.total_calls + EXCLUDED.total_calls, " +
           "total_errors = api_endpoint_daily_stats.total_errors + EXCLUDED.total_errors, " +
           "sum_latency_ms = api_endpoint_daily_stats.sum_latency_ms + EXCLUDED.sum_latency_ms, " +
           "updated_at = now()",
           nativeQuery = true)
    int increment(
            @Param("projectId") UUID projectId,
            @Param("date") LocalDate date,
            @Param("endpoint") String endpoint,
            @Param("region") String region,
            @Param("calls") long calls,
            @Param("errors") long errors,
            @Param("latencyMs") long latencyMs
    );
}
