package com.telemetry.domain.service;

import com.telemetry.domain.model.ArtifactKind;
import com.telemetry.domain.model.ScreenshotFrameIndex;
import com.telemetry.infrastructure.cache.DistributedCacheLock;
import com.telemetry.infrastructure.cache.RedisCacheService;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.repository.ArtifactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-session index of screenshot segments, cached in Redis for the replay player.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreenshotFrameService {

    static final Duration CACHE_TTL = Duration.ofHours(1);
    private static final Duration LOCK_TTL = Duration.ofSeconds(10);

    private final ArtifactRepository artifactRepository;
    private final RedisCacheService cache;
    private final DistributedCacheLock cacheLock;

    public ScreenshotFrameIndex getFrameIndex(String sessionId) {
        return cacheLock.getOrLoad(
                cacheKey(sessionId),
                "frames_lock:" + sessionId,
                ScreenshotFrameIndex.class,
                CACHE_TTL,
                LOCK_TTL,
                () -> load(sessionId));
    }

    /**
     * Rebuild the cached index once a session's ingest has drained.
     */
    public void prewarm(String sessionId) {
        ScreenshotFrameIndex index = load(sessionId);
        cache.set(cacheKey(sessionId), index, CACHE_TTL);
        log.info("Prewarmed {} screenshot segments for session {}", index.getSegments().size(), sessionId);
    }

    public void invalidate(String sessionId) {
        cache.invalidate(cacheKey(sessionId));
    }

    ScreenshotFrameIndex load(String sessionId) {
        List<ArtifactEntity> artifacts = artifactRepository.findBySessionIdInAndKind(List.of(sessionId), ArtifactKind.SCREENSHOTS);
        List<ScreenshotFrameIndex.Segment> segments = artifacts.stream()
                .filter(a -> a.getStatus() == ArtifactEntity.ArtifactStatus.READY)
                .sorted(Comparator.comparing(ArtifactEntity::getStartTime, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(ArtifactEntity::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(a -> new ScreenshotFrameIndex.Segment(
                        a.getId().toString(), a.getObjectKey(), a.getEndpointId(),
                        a.getStartTime(), a.getEndTime(), a.getSizeBytes()))
                .collect(Collectors.toList());
        long totalBytes = segments.stream()
                .mapToLong(s -> s.getSizeBytes() != null ? s.getSizeBytes() : 0L)
                .sum();
        return ScreenshotFrameIndex.builder()
                .sessionId(sessionId)
                .segments(segments)
                .totalBytes(totalBytes)
                .build();
    }

    static String cacheKey(String sessionId) {
        return "frames:" + sessionId;
    }
}
