package com.telemetry.domain.service;

import com.telemetry.domain.exception.SessionNotFoundException;
import com.telemetry.domain.exception.StorageConfigurationException;
import com.telemetry.domain.model.ArtifactKind;
import com.telemetry.domain.service.extract.ArtifactExtractorRegistry;
import com.telemetry.domain.service.extract.ExtractionContext;
import com.telemetry.infrastructure.async.BackgroundTaskRunner;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity.JobStatus;
import com.telemetry.infrastructure.persistence.entity.ProjectEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.repository.ArtifactRepository;
import com.telemetry.infrastructure.persistence.repository.IngestJobRepository;
import com.telemetry.infrastructure.persistence.repository.ProjectRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import com.telemetry.infrastructure.storage.ArtifactStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.DoubleSupplier;

/**
 * Runs one ingest job end to end.
 *
 * Processing Flow:
 * 1. Claim the job (PENDING to PROCESSING, attempts + 1); lose the race and skip
 * 2. Load session, project and artifact rows
 * 3. Download the artifact from the endpoint it was uploaded to
 * 4. Hand the bytes to the extractor for the job's kind
 * 5. Mark artifact READY and job DONE
 * 6. When the session has no queued work left, schedule promotion,
 *    frame-index prewarm and, occasionally, funnel learning
 *
 * Failure Handling:
 * - Missing session or storage misconfiguration: straight to DLQ
 * - Anything else: back to PENDING with exponential backoff until
 *   {@code max-attempts}, then DLQ
 */
@Slf4j
@Service
public class ArtifactJobProcessor {

    static final int MAX_ERROR_LENGTH = 1000;

    private static final List<JobStatus> ACTIVE_STATUSES = List.of(JobStatus.PENDING, JobStatus.PROCESSING);

    private final IngestJobRepository jobRepository;
    private final SessionRepository sessionRepository;
    private final ProjectRepository projectRepository;
    private final ArtifactRepository artifactRepository;
    private final ArtifactStore artifactStore;
    private final ArtifactExtractorRegistry extractors;
    private final PromotionEvaluator promotionEvaluator;
    private final ScreenshotFrameService frameService;
    private final FunnelAnalysisService funnelAnalysis;
    private final BackgroundTaskRunner backgroundTasks;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final DoubleSupplier random;
    private final int maxAttempts;
    private final double funnelSampleRate;

    public ArtifactJobProcessor(IngestJobRepository jobRepository,
                                SessionRepository sessionRepository,
                                ProjectRepository projectRepository,
                                ArtifactRepository artifactRepository,
                                ArtifactStore artifactStore,
                                ArtifactExtractorRegistry extractors,
                                PromotionEvaluator promotionEvaluator,
                                ScreenshotFrameService frameService,
                                FunnelAnalysisService funnelAnalysis,
                                BackgroundTaskRunner backgroundTasks,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                DoubleSupplier random,
                                @Value("${ingest.worker.max-attempts:3}") int maxAttempts,
                                @Value("${ingest.worker.funnel-sample-rate:0.05}") double funnelSampleRate) {
        this.jobRepository = jobRepository;
        this.sessionRepository = sessionRepository;
        this.projectRepository = projectRepository;
        this.artifactRepository = artifactRepository;
        this.artifactStore = artifactStore;
        this.extractors = extractors;
        this.promotionEvaluator = promotionEvaluator;
        this.frameService = frameService;
        this.funnelAnalysis = funnelAnalysis;
        this.backgroundTasks = backgroundTasks;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.random = random;
        this.maxAttempts = maxAttempts;
        this.funnelSampleRate = funnelSampleRate;
    }

    /**
     * @return the outcome recorded for the job
     */
    public JobOutcome process(IngestJobEntity job) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Instant claimedAt = clock.instant();

        if (jobRepository.claim(job.getId(), JobStatus.PENDING, JobStatus.PROCESSING, claimedAt) == 0) {
            log.debug("Job {} already claimed elsewhere", job.getId());
            return record(JobOutcome.SKIPPED);
        }
        int attempts = job.getAttempts() + 1;

        try {
            JobOutcome outcome = run(job, claimedAt);
            return record(outcome);
        } catch (SessionNotFoundException e) {
            log.warn("Job {} references missing session {}, moving to DLQ", job.getId(), e.getSessionId());
            jobRepository.moveToDlq(job.getId(), sanitize("Session not found: " + e.getSessionId()), clock.instant());
            return record(JobOutcome.DLQ);
        } catch (StorageConfigurationException e) {
            log.error("Job {} cannot reach storage for project {}: {}", job.getId(), job.getProjectId(), e.getMessage());
            jobRepository.moveToDlq(job.getId(), sanitize(e.getMessage()), clock.instant());
            return record(JobOutcome.DLQ);
        } catch (RuntimeException e) {
            log.error("Job {} ({}) failed on attempt {}", job.getId(), job.getKind(), attempts, e);
            return record(fail(job, attempts, e));
        } finally {
            sample.stop(Timer.builder("ingest.job.latency")
                    .tag("kind", job.getKind().pathSegment())
                    .register(meterRegistry));
        }
    }

    private JobOutcome run(IngestJobEntity job, Instant now) {
        SessionEntity session = loadSession(job);
        ProjectEntity project = projectRepository.findById(job.getProjectId()).orElse(null);
        ArtifactEntity artifact = job.getArtifactId() != null
                ? artifactRepository.findById(job.getArtifactId()).orElse(null)
                : null;

        String objectKey = artifact != null ? artifact.getObjectKey() : job.getPayloadRef();
        String endpointId = artifact != null ? artifact.getEndpointId() : null;
        Optional<byte[]> data = objectKey != null
                ? artifactStore.download(job.getProjectId(), objectKey, endpointId)
                : Optional.empty();

        JobOutcome outcome;
        if (data.isEmpty() || data.get().length == 0) {
            log.warn("No data found for job {} (key {}), completing without extraction", job.getId(), objectKey);
            outcome = JobOutcome.EMPTY;
        } else {
            extractors.forKind(job.getKind()).extract(ExtractionContext.builder()
                    .job(job)
                    .session(session)
                    .project(project)
                    .artifact(artifact)
                    .data(data.get())
                    .now(now)
                    .build());
            outcome = JobOutcome.DONE;
        }

        complete(job);
        if (session != null) {
            onJobFinished(session, job);
        }
        log.debug("Job {} completed: {}", job.getId(), outcome);
        return outcome;
    }

    private SessionEntity loadSession(IngestJobEntity job) {
        if (job.getSessionId() == null) {
            // Crash and ANR payloads may name their session themselves
            if (job.getKind() == ArtifactKind.CRASHES || job.getKind() == ArtifactKind.ANRS) {
                return null;
            }
            throw new SessionNotFoundException(null);
        }
        return sessionRepository.findById(job.getSessionId())
                .orElseThrow(() -> new SessionNotFoundException(job.getSessionId()));
    }

    private void complete(IngestJobEntity job) {
        Instant now = clock.instant();
        if (job.getArtifactId() != null) {
            artifactRepository.markReady(job.getArtifactId(), now);
        }
        jobRepository.markDone(job.getId(), now);
    }

    private void onJobFinished(SessionEntity session, IngestJobEntity job) {
        if (jobRepository.countBySessionIdAndStatusIn(session.getId(), ACTIVE_STATUSES) > 0) {
            return;
        }
        String sessionId = session.getId();
        int durationSeconds = session.getDurationSeconds() != null ? session.getDurationSeconds() : 0;
        log.info("No more pending ingest jobs for session {}, triggering promotion evaluation", sessionId);

        backgroundTasks.submit("promotion", () -> promotionEvaluator.evaluate(sessionId, job.getProjectId(), durationSeconds));
        backgroundTasks.submit("frame-prewarm", () -> frameService.prewarm(sessionId));
        if (random.getAsDouble() < funnelSampleRate) {
            backgroundTasks.submit("funnel-analysis", () -> funnelAnalysis.analyzeProjectFunnel(job.getProjectId()));
        }
    }

    private JobOutcome fail(IngestJobEntity job, int attempts, RuntimeException error) {
        String message = sanitize(error.getClass().getSimpleName() + ": " + error.getMessage());
        Instant now = clock.instant();
        if (attempts >= maxAttempts) {
            jobRepository.moveToDlq(job.getId(), message, now);
            log.warn("Job {} moved to DLQ after {} attempts", job.getId(), attempts);
            return JobOutcome.DLQ;
        }
        Instant nextRunAt = now.plus(backoff(attempts));
        jobRepository.scheduleRetry(job.getId(), message, nextRunAt, now);
        log.info("Job {} scheduled for retry at {} (attempt {}/{})", job.getId(), nextRunAt, attempts, maxAttempts);
        return JobOutcome.RETRY;
    }

    static Duration backoff(int attempts) {
        return Duration.ofSeconds(1L << Math.min(attempts, 20));
    }

    /**
     * PostgreSQL rejects NUL in text columns.
     */
    static String sanitize(String message) {
        String cleaned = String.valueOf(message).replace("\u0000", "");
        return cleaned.length() > MAX_ERROR_LENGTH ? cleaned.substring(0, MAX_ERROR_LENGTH) : cleaned;
    }

    private JobOutcome record(JobOutcome outcome) {
        Counter.builder("ingest.jobs")
                .tag("outcome", outcome.tag())
                .register(meterRegistry)
                .increment();
        return outcome;
    }

    public enum JobOutcome {
        DONE,
        EMPTY,
        RETRY,
        DLQ,
        SKIPPED;

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
