package com.telemetry.infrastructure.storage;

import com.telemetry.domain.exception.ArtifactDownloadException;
import com.telemetry.domain.model.ObjectMetadata;
import com.telemetry.domain.model.StorageEndpoint;
import com.telemetry.infrastructure.async.BackgroundTaskRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;

/**
 * Artifact blobs across several S3-compatible endpoints.
 *
 * Writes go to one primary endpoint, chosen per upload, and are copied in
 * the background to every active shadow. Reads are pinned to the endpoint
 * recorded with the artifact; the project's default endpoint is only used
 * for artifacts that never recorded one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtifactStore {

    private static final int DELETE_BATCH_SIZE = 1000;

    private final StorageEndpointResolver endpointResolver;
    private final S3ClientPool clientPool;
    private final BackgroundTaskRunner backgroundTasks;

    /**
     * Upload to the project's primary endpoint, then replicate to shadows.
     *
     * @return id of the endpoint holding the primary copy
     */
    public String upload(UUID projectId, String key, byte[] body, String contentType, Map<String, String> metadata) {
        StorageEndpoint endpoint = endpointResolver.resolveForProject(projectId);
        put(endpoint, key, body, contentType, metadata);
        log.debug("Uploaded {} to endpoint {}", key, endpoint.getId());

        backgroundTasks.submit("shadow-upload", () -> uploadToShadows(projectId, key, body, contentType, metadata));
        return endpoint.getId();
    }

    /**
     * Download an artifact from the endpoint it was written to.
     *
     * @return empty when the object does not exist or has no body
     * @throws ArtifactDownloadException on transport or service errors
     */
    public Optional<byte[]> download(UUID projectId, String key, String endpointId) {
        StorageEndpoint endpoint = endpointFor(projectId, endpointId);
        S3ClientPool.Clients clients = clientPool.clientsFor(endpoint);

        byte[] raw;
        try {
            ResponseBytes<GetObjectResponse> response = clients.getClient().getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(clients.getBucket())
                    .key(key)
                    .build());
            raw = response.asByteArray();
        } catch (NoSuchKeyException e) {
            log.warn("Object {} not found on endpoint {}", key, endpoint.getId());
            return Optional.empty();
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                log.warn("Object {} not found on endpoint {}", key, endpoint.getId());
                return Optional.empty();
            }
            throw new ArtifactDownloadException("Failed to download " + key + " from endpoint " + endpoint.getId(), e);
        } catch (SdkException e) {
            throw new ArtifactDownloadException("Failed to download " + key + " from endpoint " + endpoint.getId(), e);
        }

        if (raw == null || raw.length == 0) {
            return Optional.empty();
        }
        return Optional.of(key.endsWith(".gz") ? gunzipOrRaw(key, raw) : raw);
    }

    public Optional<String> presignedUploadUrl(UUID projectId, String key, String contentType, Duration ttl) {
        StorageEndpoint endpoint = endpointResolver.resolveForProject(projectId);
        try {
            S3ClientPool.Clients clients = clientPool.clientsFor(endpoint);
            PutObjectPresignRequest request = PutObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .putObjectRequest(PutObjectRequest.builder()
                            .bucket(clients.getBucket())
                            .key(key)
                            .contentType(contentType)
                            .build())
                    .build();
            return Optional.of(clients.getPresigner().presignPutObject(request).url().toString());
        } catch (SdkException e) {
            log.error("Failed to presign upload for {}: {}", key, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<String> presignedDownloadUrl(UUID projectId, String key, String endpointId, Duration ttl) {
        StorageEndpoint endpoint = endpointFor(projectId, endpointId);
        try {
            S3ClientPool.Clients clients = clientPool.clientsFor(endpoint);
            GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder()
                            .bucket(clients.getBucket())
                            .key(key)
                            .build())
                    .build();
            return Optional.of(clients.getPresigner().presignGetObject(request).url().toString());
        } catch (SdkException e) {
            log.error("Failed to presign download for {}: {}", key, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public boolean exists(UUID projectId, String key, String endpointId) {
        return metadata(projectId, key, endpointId).isPresent();
    }

    public Optional<ObjectMetadata> metadata(UUID projectId, String key, String endpointId) {
        StorageEndpoint endpoint = endpointFor(projectId, endpointId);
        S3ClientPool.Clients clients = clientPool.clientsFor(endpoint);
        try {
            HeadObjectResponse head = clients.getClient().headObject(HeadObjectRequest.builder()
                    .bucket(clients.getBucket())
                    .key(key)
                    .build());
            return Optional.of(ObjectMetadata.builder()
                    .size(head.contentLength() != null ? head.contentLength() : 0L)
                    .contentType(head.contentType())
                    .lastModified(head.lastModified())
                    .build());
        } catch (SdkException e) {
            log.debug("HEAD {} on endpoint {} failed: {}", key, endpoint.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Delete one object from a specific endpoint.
     *
     * @return false when the delete failed; the failure is logged
     */
    public boolean delete(UUID projectId, String key, String endpointId) {
        StorageEndpoint endpoint = endpointFor(projectId, endpointId);
        S3ClientPool.Clients clients = clientPool.clientsFor(endpoint);
        try {
            clients.getClient().deleteObject(DeleteObjectRequest.builder()
                    .bucket(clients.getBucket())
                    .key(key)
                    .build());
            log.debug("Deleted {} from endpoint {}", key, endpoint.getId());
            return true;
        } catch (SdkException e) {
            log.error("Failed to delete {} from endpoint {}: {}", key, endpoint.getId(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Erase every object of a project on all active endpoints of the project
     * and the global scope. Every endpoint is attempted; shadow failures are
     * logged, the first primary failure is rethrown afterwards.
     */
    public void deleteProjectAssets(UUID projectId, UUID teamId) {
        String prefix = ObjectKeys.projectPrefix(teamId, projectId);
        RuntimeException primaryFailure = null;

        for (StorageEndpoint endpoint : endpointResolver.allFor(projectId)) {
            try {
                long deleted = deletePrefix(clientPool.clientsFor(endpoint), prefix);
                log.info("Deleted {} objects for project {} on endpoint {}", deleted, projectId, endpoint.getId());
            } catch (RuntimeException e) {
                if (endpoint.isShadow()) {
                    log.error("Failed to delete project {} assets on shadow endpoint {}: {}",
                            projectId, endpoint.getId(), e.getMessage(), e);
                } else if (primaryFailure == null) {
                    primaryFailure = e;
                } else {
                    primaryFailure.addSuppressed(e);
                }
            }
        }

        if (primaryFailure != null) {
            throw primaryFailure;
        }
    }

    /**
     * Lightweight reachability check against the global default endpoint.
     */
    public boolean isHealthy() {
        try {
            StorageEndpoint endpoint = endpointResolver.resolveForProject(null);
            S3ClientPool.Clients clients = clientPool.clientsFor(endpoint);
            clients.getClient().listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(clients.getBucket())
                    .maxKeys(1)
                    .build());
            return true;
        } catch (RuntimeException e) {
            log.warn("Storage health check failed: {}", e.getMessage());
            return false;
        }
    }

    private StorageEndpoint endpointFor(UUID projectId, String endpointId) {
        if (endpointId != null) {
            Optional<StorageEndpoint> pinned = endpointResolver.findById(endpointId);
            if (pinned.isPresent()) {
                return pinned.get();
            }
            log.warn("Recorded endpoint {} is unknown, using project default", endpointId);
        }
        return endpointResolver.resolveForProject(projectId);
    }

    private void uploadToShadows(UUID projectId, String key, byte[] body, String contentType, Map<String, String> metadata) {
        for (StorageEndpoint shadow : endpointResolver.shadowsFor(projectId)) {
            try {
                put(shadow, key, body, contentType, metadata);
                log.debug("Shadow upload of {} to endpoint {} complete", key, shadow.getId());
            } catch (RuntimeException e) {
                log.warn("Shadow upload of {} to endpoint {} failed: {}", key, shadow.getId(), e.getMessage());
            }
        }
    }

    private void put(StorageEndpoint endpoint, String key, byte[] body, String contentType, Map<String, String> metadata) {
        S3ClientPool.Clients clients = clientPool.clientsFor(endpoint);
        PutObjectRequest.Builder request = PutObjectRequest.builder()
                .bucket(clients.getBucket())
                .key(key)
                .contentType(contentType);
        if (metadata != null && !metadata.isEmpty()) {
            request.metadata(metadata);
        }
        clients.getClient().putObject(request.build(), RequestBody.fromBytes(body));
    }

    private long deletePrefix(S3ClientPool.Clients clients, String prefix) {
        S3Client client = clients.getClient();
        String continuationToken = null;
        long deleted = 0;

        do {
            ListObjectsV2Response page = client.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(clients.getBucket())
                    .prefix(prefix)
                    .continuationToken(continuationToken)
                    .build());

            List<ObjectIdentifier> keys = page.contents().stream()
                    .map(S3Object::key)
                    .filter(k -> k != null)
                    .map(k -> ObjectIdentifier.builder().key(k).build())
                    .collect(Collectors.toList());
            if (keys.isEmpty()) {
                break;
            }

            for (int from = 0; from < keys.size(); from += DELETE_BATCH_SIZE) {
                List<ObjectIdentifier> batch = keys.subList(from, Math.min(from + DELETE_BATCH_SIZE, keys.size()));
                client.deleteObjects(DeleteObjectsRequest.builder()
                        .bucket(clients.getBucket())
                        .delete(Delete.builder().objects(batch).quiet(true).build())
                        .build());
                deleted += batch.size();
            }

            continuationToken = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
        } while (continuationToken != null);

        return deleted;
    }

    private static byte[] gunzipOrRaw(String key, byte[] raw) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return in.readAllBytes();
        } catch (IOException e) {
            log.warn("Failed to decompress {}, using raw bytes: {}", key, e.getMessage());
            return raw;
        }
    }
}
