package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "crashes", indexes = {
    @Index(name = "idx_crashes_project_fingerprint", columnList = "projectId,fingerprint")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrashEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 64)
    private String sessionId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false)
    private String exceptionName;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(columnDefinition = "TEXT")
    private String stackTrace;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "s3_object_key", columnDefinition = "TEXT")
    private String objectKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> deviceMetadata;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String status = "open";

    @Column(nullable = false)
    @Builder.Default
    private int occurrenceCount = 1;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
