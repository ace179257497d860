package com.telemetry.infrastructure.storage;

import com.telemetry.domain.exception.StorageConfigurationException;
import com.telemetry.domain.model.StorageEndpoint;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One S3 client and one presigner per endpoint id, created on first use.
 *
 * The presigner targets the public endpoint so URLs handed to devices and
 * browsers resolve outside the cluster.
 */
@Slf4j
@Component
public class S3ClientPool {

    private static final String DEFAULT_REGION = "us-east-1";

    private final StorageProperties properties;
    private final SecretCipher secretCipher;
    private final Map<String, Clients> pool = new ConcurrentHashMap<>();

    public S3ClientPool(StorageProperties properties, SecretCipher secretCipher) {
        this.properties = properties;
        this.secretCipher = secretCipher;
    }

    public Clients clientsFor(StorageEndpoint endpoint) {
        return pool.computeIfAbsent(endpoint.getId(), id -> create(endpoint));
    }

    @PreDestroy
    void shutdown() {
        pool.values().forEach(Clients::close);
        pool.clear();
    }

    private Clients create(StorageEndpoint endpoint) {
        StorageProperties.Fallback fallback = properties.getFallback();
        boolean selfHosted = properties.isSelfHosted();

        String accessKeyId = endpoint.getAccessKeyId();
        String secretAccessKey = secretCipher.safeDecrypt(endpoint.getKeyRef());
        String region = endpoint.getRegion();
        if (selfHosted) {
            accessKeyId = firstNonBlank(accessKeyId, fallback.getAccessKeyId());
            secretAccessKey = firstNonBlank(secretAccessKey, fallback.getSecretAccessKey());
            region = firstNonBlank(region, fallback.getRegion());
        }

        if (isBlank(accessKeyId) || isBlank(secretAccessKey)) {
            throw new StorageConfigurationException(selfHosted
                    ? "S3 credentials missing for endpoint " + endpoint.getId() + ". Set storage.fallback.access-key-id and secret-access-key."
                    : "S3 credentials missing for endpoint " + endpoint.getId() + ". Configure access_key_id and key_ref in storage_endpoints.");
        }

        StaticCredentialsProvider credentials = StaticCredentialsProvider.create(
                AwsBasicCredentials.create(accessKeyId, secretAccessKey));
        Region awsRegion = Region.of(isBlank(region) ? DEFAULT_REGION : region);
        S3Configuration pathStyle = S3Configuration.builder()
                .pathStyleAccessEnabled(true)
                .build();

        S3Client client = S3Client.builder()
                .endpointOverride(URI.create(endpoint.getEndpointUrl()))
                .region(awsRegion)
                .credentialsProvider(credentials)
                .serviceConfiguration(pathStyle)
                .build();

        S3Presigner presigner = S3Presigner.builder()
                .endpointOverride(URI.create(publicEndpointFor(endpoint)))
                .region(awsRegion)
                .credentialsProvider(credentials)
                .serviceConfiguration(pathStyle)
                .build();

        log.info("Created S3 client for endpoint {} ({})", endpoint.getId(), endpoint.getEndpointUrl());
        return new Clients(client, presigner, endpoint.getBucket());
    }

    private String publicEndpointFor(StorageEndpoint endpoint) {
        if (!isBlank(properties.getPublicEndpoint())) {
            return properties.getPublicEndpoint();
        }
        // Local docker setups address MinIO by its service name
        return endpoint.getEndpointUrl().replace("minio:9000", "localhost:9000");
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return isBlank(preferred) ? fallback : preferred;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    public static class Clients {
        S3Client client;
        S3Presigner presigner;
        String bucket;

        void close() {
            client.close();
            presigner.close();
        }
    }
}
