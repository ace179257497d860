package com.telemetry.infrastructure.storage;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Storage settings.
 *
 * {@code fallback} describes the single endpoint used in self-hosted mode
 * when {@code storage_endpoints} is empty; its keys also fill in missing
 * credentials of stored endpoints in that mode.
 */
@Data
@ConfigurationProperties("storage")
public class StorageProperties {

    private boolean selfHosted;

    // 64 hex chars, AES-256 key for storage_endpoints.key_ref
    private String encryptionKey;

    // Host used in presigned URLs handed to clients
    private String publicEndpoint;

    private Fallback fallback = new Fallback();

    @Data
    public static class Fallback {
        private String endpoint;
        private String bucket;
        private String region = "us-east-1";
        private String accessKeyId;
        private String secretAccessKey;

        public boolean isConfigured() {
            return endpoint != null && !endpoint.isBlank() && bucket != null && !bucket.isBlank();
        }
    }
}
