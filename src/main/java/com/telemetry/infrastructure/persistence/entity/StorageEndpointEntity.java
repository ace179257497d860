package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Configured S3-compatible storage target.
 *
 * A null {@code projectId} marks a global endpoint. Shadow endpoints only
 * receive best-effort copies and are never read from.
 */
@Entity
@Table(name = "storage_endpoints")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageEndpointEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(columnDefinition = "UUID")
    private UUID projectId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String endpointUrl;

    @Column(nullable = false)
    private String bucket;

    @Column(length = 50)
    private String region;

    @Column
    private String accessKeyId;

    // Encrypted secret (iv:tag:ciphertext) or a legacy plaintext value
    @Column
    private String keyRef;

    @Column(nullable = false)
    private int priority;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(nullable = false)
    private boolean shadow;
}
