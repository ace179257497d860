package com.telemetry.domain.service;

import com.telemetry.domain.model.ArtifactKind;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.repository.ArtifactRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import com.telemetry.infrastructure.storage.ArtifactStore;
import com.telemetry.infrastructure.storage.ObjectKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Deletes screenshot archives of sessions that outlived their retention tier.
 *
 * Tiers: 1 = 7 days, 2 = 30 days, 3 = 90 days, 4 = 365 days, 5 = kept forever.
 * Only objects whose key identifies a screenshot archive are removed, always
 * on the endpoint the artifact was written to. Session rows and their
 * metrics stay; the session is flagged {@code recordingDeleted}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionSweeper {

    static final Map<Integer, Duration> TIER_WINDOWS = Map.of(
            1, Duration.ofDays(7),
            2, Duration.ofDays(30),
            3, Duration.ofDays(90),
            4, Duration.ofDays(365));

    static final int BATCH_LIMIT = 100;

    private final SessionRepository sessionRepository;
    private final ArtifactRepository artifactRepository;
    private final ArtifactStore artifactStore;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${retention.sweep-interval-ms:21600000}",
               initialDelayString = "${retention.initial-delay-ms:60000}")
    public void run() {
        try {
            int swept = sweep();
            if (swept > 0) {
                log.info("Retention sweep removed recordings of {} sessions", swept);
            }
        } catch (RuntimeException e) {
            log.error("Retention sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of sessions whose recordings were removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int swept = 0;
        for (int tier = 1; tier <= 4; tier++) {
            Instant cutoff = now.minus(TIER_WINDOWS.get(tier));
            List<SessionEntity> expired = sessionRepository.findExpiredRecordings(tier, cutoff, BATCH_LIMIT);
            for (SessionEntity session : expired) {
                try {
                    if (deleteRecording(session, now)) {
                        swept++;
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to delete recording of session {}", session.getId(), e);
                }
            }
        }
        return swept;
    }

    /**
     * A row is removed only together with its object. Rows of keys that are not
     * screenshot archives are kept and never block the session flag; a failed
     * object delete leaves the row and the flag for the next sweep.
     *
     * @return true when the session was flagged {@code recordingDeleted}
     */
    boolean deleteRecording(SessionEntity session, Instant now) {
        List<ArtifactEntity> artifacts = artifactRepository.findBySessionIdInAndKind(
                List.of(session.getId()), ArtifactKind.SCREENSHOTS);

        int deleted = 0;
        int failed = 0;
        for (ArtifactEntity artifact : artifacts) {
            if (!ObjectKeys.isScreenshotArchive(artifact.getObjectKey())) {
                log.warn("Skipping non-archive key {} of session {}", artifact.getObjectKey(), session.getId());
                continue;
            }
            try {
                if (artifactStore.delete(session.getProjectId(), artifact.getObjectKey(), artifact.getEndpointId())) {
                    artifactRepository.delete(artifact);
                    deleted++;
                } else {
                    failed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to delete screenshot artifact {} of session {}", artifact.getId(), session.getId(), e);
                failed++;
            }
        }

        if (failed > 0) {
            log.warn("Session {} (tier {}): {} screenshot archives left for the next sweep",
                    session.getId(), session.getRetentionTier(), failed);
            return false;
        }
        sessionRepository.markRecordingDeleted(session.getId(), now);
        log.debug("Session {} (tier {}): deleted {} of {} screenshot artifacts",
                session.getId(), session.getRetentionTier(), deleted, artifacts.size());
        return true;
    }
}
