package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "device_usage")
@IdClass(DeviceUsageEntity.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceUsageEntity {

    @Id
    @Column(nullable = false)
    private String deviceId;

    @Id
    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Id
    @Column(nullable = false)
    private LocalDate period;

    private int requestCount;

    private int minutesRecorded;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String deviceId;
        private UUID projectId;
        private LocalDate period;
    }
}
