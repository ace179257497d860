package com.telemetry.domain.service.extract;

import com.telemetry.domain.exception.SessionNotFoundException;
import com.telemetry.domain.model.ArtifactKind;
import com.telemetry.domain.service.ScreenshotFrameService;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.repository.SessionMetricsRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * Screenshot and hierarchy artifacts that reached the queue through recovery
 * (auto-finalize) rather than the upload-complete path. Only usage counters
 * and the session end are updated; the bytes themselves are not parsed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReplayArtifactRecoveryExtractor implements ArtifactExtractor {

    private final SessionRepository sessionRepository;
    private final SessionMetricsRepository metricsRepository;
    private final ScreenshotFrameService frameService;

    @Override
    @Transactional
    public void extract(ExtractionContext context) {
        SessionEntity session = context.getSession();
        if (session == null) {
            throw new SessionNotFoundException(context.getJob().getSessionId());
        }
        ArtifactEntity artifact = context.getArtifact();
        if (artifact == null) {
            log.warn("Artifact {} missing while recovering {} counters", context.getJob().getArtifactId(), context.getJob().getKind());
            return;
        }

        metricsRepository.insertIfMissing(session.getId());
        if (context.getJob().getKind() == ArtifactKind.SCREENSHOTS) {
            recoverScreenshots(context, session, artifact);
        } else {
            metricsRepository.addHierarchySnapshots(session.getId(), 1);
            log.info("Recovered hierarchy artifact counters for session {} (artifact {})", session.getId(), artifact.getId());
        }
    }

    private void recoverScreenshots(ExtractionContext context, SessionEntity session, ArtifactEntity artifact) {
        long sizeBytes = context.getData().length > 0
                ? context.getData().length
                : (artifact.getSizeBytes() != null ? artifact.getSizeBytes() : 0L);

        sessionRepository.addReplayUsage(session.getId(), 1, sizeBytes, context.getNow());
        metricsRepository.addScreenshotSegments(session.getId(), 1, sizeBytes);

        if (artifact.getEndTime() != null && session.getEndedAt() != null) {
            Instant segmentEnd = Instant.ofEpochMilli(artifact.getEndTime());
            if (segmentEnd.isAfter(session.getEndedAt())) {
                long seconds = Math.round(Duration.between(session.getStartedAt(), segmentEnd).toMillis() / 1000.0);
                int duration = seconds > 0 ? (int) seconds
                        : (session.getDurationSeconds() != null ? session.getDurationSeconds() : 1);
                sessionRepository.extendEndedAt(session.getId(), segmentEnd, duration, context.getNow());
            }
        }

        frameService.invalidate(session.getId());
        log.info("Recovered screenshot artifact counters for session {} (artifact {}, {} bytes)",
                session.getId(), artifact.getId(), sizeBytes);
    }
}
