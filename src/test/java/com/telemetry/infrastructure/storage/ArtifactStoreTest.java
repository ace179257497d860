package com.telemetry.infrastructure.storage;

import com.telemetry.domain.exception.ArtifactDownloadException;
import com.telemetry.domain.exception.StorageConfigurationException;
import com.telemetry.domain.model.ObjectMetadata;
import com.telemetry.domain.model.StorageEndpoint;
import com.telemetry.infrastructure.async.BackgroundTaskRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ArtifactStore.
 *
 * Reads must go to the endpoint recorded with the artifact, never to a freshly
 * resolved one.
 */
@ExtendWith(MockitoExtension.class)
class ArtifactStoreTest {

    private static final UUID PROJECT_ID = UUID.randomUUID();
    private static final String KEY = "tenant/t/project/p/sessions/s/events/batch-1.json";

    @Mock
    private StorageEndpointResolver endpointResolver;

    @Mock
    private S3ClientPool clientPool;

    @Mock
    private BackgroundTaskRunner backgroundTasks;

    @Mock
    private S3Client s3Client;

    @Mock
    private S3Presigner presigner;

    private final StorageEndpoint pinned = StorageEndpoint.builder().id("endpoint-b").bucket("bucket-b").build();
    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(endpointResolver, clientPool, backgroundTasks);
    }

    @Test
    void testDownload_UsesRecordedEndpoint() {
        // Given
        givenPinnedEndpoint();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), "[]".getBytes(StandardCharsets.UTF_8)));

        // When
        Optional<byte[]> data = store.download(PROJECT_ID, KEY, "endpoint-b");

        // Then
        assertTrue(data.isPresent());
        assertEquals("[]", new String(data.get(), StandardCharsets.UTF_8));
        verify(endpointResolver, never()).resolveForProject(any());

        ArgumentCaptor<GetObjectRequest> request = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(request.capture());
        assertEquals("bucket-b", request.getValue().bucket());
    }

    @Test
    void testDownload_MissingObjectIsEmpty() {
        // Given
        givenPinnedEndpoint();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        // When
        Optional<byte[]> data = store.download(PROJECT_ID, KEY, "endpoint-b");

        // Then
        assertTrue(data.isEmpty());
    }

    @Test
    void testDownload_ServiceErrorPropagates() {
        // Given
        givenPinnedEndpoint();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(503).message("slow down").build());

        // When / Then
        assertThrows(ArtifactDownloadException.class, () -> store.download(PROJECT_ID, KEY, "endpoint-b"));
    }

    @Test
    void testDownload_GzipIsDecompressed() throws IOException {
        // Given
        givenPinnedEndpoint();
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), gzip("{\"events\":[]}")));

        // When
        Optional<byte[]> data = store.download(PROJECT_ID, KEY + ".gz", "endpoint-b");

        // Then
        assertEquals("{\"events\":[]}", new String(data.orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void testDownload_UnknownEndpointUsesProjectDefault() {
        // Given
        when(endpointResolver.findById("gone")).thenReturn(Optional.empty());
        when(endpointResolver.resolveForProject(PROJECT_ID)).thenReturn(pinned);
        when(clientPool.clientsFor(pinned)).thenReturn(new S3ClientPool.Clients(s3Client, presigner, "bucket-b"));
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), new byte[0]));

        // When
        Optional<byte[]> data = store.download(PROJECT_ID, KEY, "gone");

        // Then: an empty body counts as missing
        assertTrue(data.isEmpty());
        verify(endpointResolver).resolveForProject(PROJECT_ID);
    }

    @Test
    void testUpload_ReturnsPrimaryAndSchedulesShadowCopy() {
        // Given
        when(endpointResolver.resolveForProject(PROJECT_ID)).thenReturn(pinned);
        when(clientPool.clientsFor(pinned)).thenReturn(new S3ClientPool.Clients(s3Client, presigner, "bucket-b"));

        // When
        String endpointId = store.upload(PROJECT_ID, KEY, new byte[]{1, 2, 3}, "application/json", Map.of("session", "s"));

        // Then
        assertEquals("endpoint-b", endpointId);
        verify(s3Client).putObject(any(PutObjectRequest.class), any(RequestBody.class));
        verify(backgroundTasks).submit(eq("shadow-upload"), any(Runnable.class));
    }

    @Test
    void testUpload_ShadowFailureDoesNotStopOtherShadows() {
        // Given
        StorageEndpoint shadowA = StorageEndpoint.builder().id("shadow-a").bucket("a").shadow(true).build();
        StorageEndpoint shadowB = StorageEndpoint.builder().id("shadow-b").bucket("b").shadow(true).build();
        S3Client failing = mock(S3Client.class);
        when(endpointResolver.resolveForProject(PROJECT_ID)).thenReturn(pinned);
        when(endpointResolver.shadowsFor(PROJECT_ID)).thenReturn(List.of(shadowA, shadowB));
        when(clientPool.clientsFor(pinned)).thenReturn(new S3ClientPool.Clients(s3Client, presigner, "bucket-b"));
        when(clientPool.clientsFor(shadowA)).thenReturn(new S3ClientPool.Clients(failing, presigner, "a"));
        when(clientPool.clientsFor(shadowB)).thenReturn(new S3ClientPool.Clients(s3Client, presigner, "b"));
        when(failing.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(500).message("down").build());
        doAnswer(invocation -> {
            invocation.getArgument(1, Runnable.class).run();
            return null;
        }).when(backgroundTasks).submit(eq("shadow-upload"), any(Runnable.class));

        // When
        store.upload(PROJECT_ID, KEY, new byte[]{1}, "application/json", Map.of());

        // Then: primary plus shadow-b
        verify(s3Client, times(2)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void testDelete_FailureReportedAsFalse() {
        // Given
        givenPinnedEndpoint();
        when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());

        // When
        boolean deleted = store.delete(PROJECT_ID, KEY, "endpoint-b");

        // Then
        assertFalse(deleted);
    }

    @Test
    void testMetadata_ReadsHeadFromRecordedEndpoint() {
        // Given
        givenPinnedEndpoint();
        Instant modified = Instant.parse("2026-03-01T10:00:00Z");
        when(s3Client.headObject(any(HeadObjectRequest.class))).thenReturn(HeadObjectResponse.builder()
                .contentLength(42L)
                .contentType("application/json")
                .lastModified(modified)
                .build());

        // When
        Optional<ObjectMetadata> metadata = store.metadata(PROJECT_ID, KEY, "endpoint-b");

        // Then
        assertTrue(metadata.isPresent());
        assertEquals(42L, metadata.get().getSize());
        assertEquals(modified, metadata.get().getLastModified());
        assertTrue(store.exists(PROJECT_ID, KEY, "endpoint-b"));
    }

    @Test
    void testPresignedDownloadUrl_SignsOnRecordedEndpoint() throws Exception {
        // Given
        givenPinnedEndpoint();
        PresignedGetObjectRequest presigned = mock(PresignedGetObjectRequest.class);
        when(presigned.url()).thenReturn(new URL("https://storage-b.example.com/bucket-b/object?sig=1"));
        when(presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presigned);

        // When
        Optional<String> url = store.presignedDownloadUrl(PROJECT_ID, KEY, "endpoint-b", Duration.ofMinutes(15));

        // Then
        assertEquals(Optional.of("https://storage-b.example.com/bucket-b/object?sig=1"), url);
        ArgumentCaptor<GetObjectPresignRequest> request = ArgumentCaptor.forClass(GetObjectPresignRequest.class);
        verify(presigner).presignGetObject(request.capture());
        assertEquals("bucket-b", request.getValue().getObjectRequest().bucket());
        assertEquals(Duration.ofMinutes(15), request.getValue().signatureDuration());
    }

    @Test
    void testDeleteProjectAssets_ErasesEveryPrimaryAndShadow() {
        // Given two load-balanced primaries and a failing shadow
        UUID teamId = UUID.randomUUID();
        StorageEndpoint primaryA = StorageEndpoint.builder().id("endpoint-a").bucket("bucket-a").build();
        StorageEndpoint shadow = StorageEndpoint.builder().id("shadow-a").bucket("a").shadow(true).build();
        S3Client clientA = mock(S3Client.class);
        S3Client failing = mock(S3Client.class);
        when(endpointResolver.allFor(PROJECT_ID)).thenReturn(List.of(primaryA, pinned, shadow));
        when(clientPool.clientsFor(primaryA)).thenReturn(new S3ClientPool.Clients(clientA, presigner, "bucket-a"));
        when(clientPool.clientsFor(pinned)).thenReturn(new S3ClientPool.Clients(s3Client, presigner, "bucket-b"));
        when(clientPool.clientsFor(shadow)).thenReturn(new S3ClientPool.Clients(failing, presigner, "a"));
        when(clientA.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(listing("k1"));
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(listing("k2", "k3"));
        when(failing.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenThrow(S3Exception.builder().statusCode(500).message("down").build());

        // When
        assertDoesNotThrow(() -> store.deleteProjectAssets(PROJECT_ID, teamId));

        // Then
        ArgumentCaptor<ListObjectsV2Request> listingRequest = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3Client).listObjectsV2(listingRequest.capture());
        assertEquals(ObjectKeys.projectPrefix(teamId, PROJECT_ID), listingRequest.getValue().prefix());

        ArgumentCaptor<DeleteObjectsRequest> deletesA = ArgumentCaptor.forClass(DeleteObjectsRequest.class);
        verify(clientA).deleteObjects(deletesA.capture());
        assertEquals(1, deletesA.getValue().delete().objects().size());

        ArgumentCaptor<DeleteObjectsRequest> deletesB = ArgumentCaptor.forClass(DeleteObjectsRequest.class);
        verify(s3Client).deleteObjects(deletesB.capture());
        assertEquals(2, deletesB.getValue().delete().objects().size());
    }

    @Test
    void testDeleteProjectAssets_PrimaryFailureRethrownAfterOthers() {
        // Given
        UUID teamId = UUID.randomUUID();
        StorageEndpoint primaryA = StorageEndpoint.builder().id("endpoint-a").bucket("bucket-a").build();
        S3Client failing = mock(S3Client.class);
        when(endpointResolver.allFor(PROJECT_ID)).thenReturn(List.of(primaryA, pinned));
        when(clientPool.clientsFor(primaryA)).thenReturn(new S3ClientPool.Clients(failing, presigner, "bucket-a"));
        when(clientPool.clientsFor(pinned)).thenReturn(new S3ClientPool.Clients(s3Client, presigner, "bucket-b"));
        when(failing.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(listing("k1"));

        // When
        assertThrows(S3Exception.class, () -> store.deleteProjectAssets(PROJECT_ID, teamId));

        // Then: the second primary was still erased
        verify(s3Client).deleteObjects(any(DeleteObjectsRequest.class));
    }

    @Test
    void testIsHealthy_FalseWithoutConfiguredEndpoint() {
        // Given
        when(endpointResolver.resolveForProject(null))
                .thenThrow(new StorageConfigurationException("No storage endpoint configured"));

        // When / Then
        assertFalse(store.isHealthy());
    }

    private void givenPinnedEndpoint() {
        when(endpointResolver.findById("endpoint-b")).thenReturn(Optional.of(pinned));
        when(clientPool.clientsFor(pinned)).thenReturn(new S3ClientPool.Clients(s3Client, presigner, "bucket-b"));
    }

    private static ListObjectsV2Response listing(String... keys) {
        return ListObjectsV2Response.builder()
                .contents(Arrays.stream(keys).map(k -> S3Object.builder().key(k).build()).toArray(S3Object[]::new))
                .isTruncated(false)
                .build();
    }

    private static byte[] gzip(String value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(value.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
