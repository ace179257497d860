package com.telemetry.domain.service;

import com.telemetry.domain.model.DeviceUsageDelta;
import com.telemetry.domain.model.PromotionResult;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.repository.ArtifactRepository;
import com.telemetry.infrastructure.persistence.repository.IngestJobRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes sessions whose app never reported an explicit end.
 *
 * A session qualifies once it has been open for a while, its newest
 * artifact is older than {@code after-ms} and nothing is queued for it.
 * The close itself is conditional on {@code endedAt} still being null, so
 * a session closed concurrently (or in an earlier run) is left alone.
 */
@Slf4j
@Service
public class SessionAutoFinalizer {

    static final int BATCH_LIMIT = 100;
    static final Duration MIN_SESSION_AGE = Duration.ofSeconds(10);

    private final SessionRepository sessionRepository;
    private final ArtifactRepository artifactRepository;
    private final IngestJobRepository jobRepository;
    private final DeviceUsageService deviceUsageService;
    private final PromotionEvaluator promotionEvaluator;
    private final IngestWorker ingestWorker;
    private final Clock clock;
    private final Duration idleAfter;

    public SessionAutoFinalizer(SessionRepository sessionRepository,
                                ArtifactRepository artifactRepository,
                                IngestJobRepository jobRepository,
                                DeviceUsageService deviceUsageService,
                                PromotionEvaluator promotionEvaluator,
                                IngestWorker ingestWorker,
                                Clock clock,
                                @Value("${ingest.auto-finalize.after-ms:60000}") long afterMs) {
        this.sessionRepository = sessionRepository;
        this.artifactRepository = artifactRepository;
        this.jobRepository = jobRepository;
        this.deviceUsageService = deviceUsageService;
        this.promotionEvaluator = promotionEvaluator;
        this.ingestWorker = ingestWorker;
        this.clock = clock;
        this.idleAfter = Duration.ofMillis(afterMs);
    }

    @Scheduled(fixedDelayString = "${ingest.auto-finalize.interval-ms:10000}")
    public void run() {
        try {
            finalizeIdleSessions();
        } catch (RuntimeException e) {
            log.error("Auto-finalize of stale sessions failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of sessions closed by this run
     */
    public int finalizeIdleSessions() {
        Instant now = clock.instant();
        List<SessionEntity> candidates = sessionRepository.findAutoFinalizeCandidates(
                now.minus(MIN_SESSION_AGE), now.minus(idleAfter), BATCH_LIMIT);
        if (candidates.isEmpty()) {
            return 0;
        }
        log.info("Auto-finalizing {} stale sessions (idle since before {})", candidates.size(), now.minus(idleAfter));

        int closed = 0;
        for (SessionEntity session : candidates) {
            if (!ingestWorker.isRunning()) {
                break;
            }
            try {
                if (finalizeSession(session, now)) {
                    closed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to auto-finalize session {}", session.getId(), e);
            }
        }
        return closed;
    }

    /**
     * Orphaned artifacts are queued before the close; once {@code endedAt} is
     * set the session is never a candidate again.
     */
    boolean finalizeSession(SessionEntity session, Instant now) {
        Instant lastArtifactAt = artifactRepository.findLastCreatedAt(session.getId());
        if (lastArtifactAt == null) {
            return false;
        }
        int durationSeconds = durationSeconds(session.getStartedAt(), lastArtifactAt);

        recoverPendingArtifacts(session, now);

        if (sessionRepository.closeIfOpen(session.getId(), lastArtifactAt, durationSeconds, now) == 0) {
            log.debug("Session {} already closed, skipping", session.getId());
            return false;
        }
        log.info("Auto-finalized session {}: duration={}s, endedAt={}", session.getId(), durationSeconds, lastArtifactAt);

        if (session.getDeviceId() != null && !session.getDeviceId().isEmpty()) {
            int minutes = (int) Math.ceil(durationSeconds / 60.0);
            try {
                deviceUsageService.record(session.getDeviceId(), session.getProjectId(), new DeviceUsageDelta(1, minutes));
            } catch (RuntimeException e) {
                log.error("Failed to record device usage for auto-finalized session {}", session.getId(), e);
            }
        }

        try {
            PromotionResult result = promotionEvaluator.evaluate(session.getId(), session.getProjectId(), durationSeconds);
            log.info("Auto-finalize promotion for session {}: promoted={}, reason={}",
                    session.getId(), result.isPromoted(), result.getReason());
        } catch (RuntimeException e) {
            log.error("Failed to evaluate promotion after auto-finalize of session {}", session.getId(), e);
        }
        return true;
    }

    /**
     * Artifacts uploaded but never confirmed: mark them ready and queue a job
     * for each one that has none yet.
     */
    private void recoverPendingArtifacts(SessionEntity session, Instant now) {
        List<ArtifactEntity> pending = artifactRepository.findBySessionIdAndStatus(
                session.getId(), ArtifactEntity.ArtifactStatus.PENDING);
        for (ArtifactEntity artifact : pending) {
            artifactRepository.markReady(artifact.getId(), now);
            if (!jobRepository.existsByArtifactId(artifact.getId())) {
                jobRepository.save(IngestJobEntity.builder()
                        .projectId(session.getProjectId())
                        .sessionId(session.getId())
                        .artifactId(artifact.getId())
                        .kind(artifact.getKind())
                        .payloadRef(artifact.getObjectKey())
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                log.debug("Queued orphaned {} artifact {} of session {}", artifact.getKind(), artifact.getId(), session.getId());
            }
        }
        if (!pending.isEmpty()) {
            log.info("Recovered {} pending artifacts of session {}", pending.size(), session.getId());
        }
    }

    static int durationSeconds(Instant startedAt, Instant endedAt) {
        long seconds = Math.round(Duration.between(startedAt, endedAt).toMillis() / 1000.0);
        return seconds <= 0 ? 1 : (int) seconds;
    }
}
