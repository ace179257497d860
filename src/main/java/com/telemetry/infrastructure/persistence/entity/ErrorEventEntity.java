package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JavaScript / promise / unhandled exception reported from inside a session.
 */
@Entity
@Table(name = "errors")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorEventEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 64)
    private String sessionId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false, length = 50)
    private String errorType;

    @Column(nullable = false)
    private String errorName;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(columnDefinition = "TEXT")
    private String stack;

    @Column
    private String screenName;

    @Column(length = 100)
    private String deviceModel;

    @Column(length = 50)
    private String osVersion;

    @Column(length = 50)
    private String appVersion;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String status = "open";

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
