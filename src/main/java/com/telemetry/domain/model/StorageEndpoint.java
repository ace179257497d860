package com.telemetry.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Resolved storage target. Either a {@code storage_endpoints} row or the
 * virtual single-tenant endpoint built from configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageEndpoint {

    public static final String ENV_FALLBACK_ID = "env-fallback";

    private String id;
    private UUID projectId;
    private String endpointUrl;
    private String bucket;
    private String region;
    private String accessKeyId;
    private String keyRef;
    private int priority;
    private boolean shadow;

    /**
     * Weight used for load balancing across endpoints of equal standing.
     */
    public int weight() {
        return priority + 1;
    }

    public boolean isEnvFallback() {
        return ENV_FALLBACK_ID.equals(id);
    }
}
