package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.DeviceUsageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.UUID;

@Repository
public interface DeviceUsageRepository extends JpaRepository<DeviceUsageEntity, DeviceUsageEntity.Key> {

    @Modifying
    @Transactional
    @Query(value = "INSERT INTO device_usage (device_id, project_id, period, request_count, minutes_recorded) " +
           "VALUES (:deviceId, :projectId, :period, :requests, :minutes) " +
           "ON CONFLICT (device_id, project_id, period) DO UPDATE SET " +
           "request_count = device_usage.request_count + EXCLUDED.request_count, " +
           "minutes_recorded = device_usage.minutes_recorded + EXCLUDED.minutes_recorded",
           nativeQuery = true)
    int increment(
            @Param("deviceId") String deviceId,
            @Param("projectId") UUID projectId,
            @Param("period") LocalDate period,
            @Param("requests") int requests,
            @Param("minutes") int minutes
    );
}
