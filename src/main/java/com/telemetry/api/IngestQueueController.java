package com.telemetry.api;

import com.telemetry.domain.model.QueueStatus;
import com.telemetry.domain.model.ScreenshotFrameIndex;
import com.telemetry.domain.service.IngestQueueService;
import com.telemetry.domain.service.IngestWorker;
import com.telemetry.domain.service.ScreenshotFrameService;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.storage.ArtifactStore;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only REST API over the ingest queue.
 *
 * Endpoints:
 * - GET /api/v1/ingest/jobs/{jobId} - Job status, attempts and last error
 * - GET /api/v1/ingest/dlq - Recently dead-lettered jobs
 * - GET /api/v1/ingest/queue - Job counts per status
 * - GET /api/v1/ingest/sessions/{sessionId}/frames - Screenshot segment index for replay
 * - GET /api/v1/ingest/health - Worker liveness and storage reachability
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/ingest")
@RequiredArgsConstructor
public class IngestQueueController {

    private final IngestQueueService queueService;
    private final IngestWorker ingestWorker;
    private final ScreenshotFrameService frameService;
    private final ArtifactStore artifactStore;

    /**
     * GET /api/v1/ingest/jobs/{jobId}
     *
     * 404 when the job does not exist.
     */
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<IngestJobEntity> getJob(@PathVariable UUID jobId) {
        log.debug("Get ingest job: jobId={}", jobId);

        IngestJobEntity job = queueService.getJob(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId));

        return ResponseEntity.ok(job);
    }

    /**
     * GET /api/v1/ingest/dlq?limit=50
     */
    @GetMapping("/dlq")
    public ResponseEntity<List<IngestJobEntity>> deadLetters(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(queueService.deadLetters(limit));
    }

    /**
     * GET /api/v1/ingest/queue
     *
     * Response:
     * {
     *   "pending": 12,
     *   "processing": 4,
     *   "done": 10234,
     *   "dlq": 3,
     *   "workerRunning": true,
     *   "checkedAt": "..."
     * }
     */
    @GetMapping("/queue")
    public ResponseEntity<QueueStatus> queueStatus() {
        return ResponseEntity.ok(queueService.queueStatus());
    }

    /**
     * GET /api/v1/ingest/sessions/{sessionId}/frames
     *
     * Served from the Redis frame cache; an unknown session yields an empty index.
     */
    @GetMapping("/sessions/{sessionId}/frames")
    public ResponseEntity<ScreenshotFrameIndex> frames(@PathVariable String sessionId) {
        log.debug("Get frame index: sessionId={}", sessionId);
        return ResponseEntity.ok(frameService.getFrameIndex(sessionId));
    }

    /**
     * Health check endpoint. 503 once the worker has been stopped; storage
     * trouble is reported but does not fail the check.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean running = ingestWorker.isRunning();
        Instant lastPollAt = ingestWorker.getLastPollAt();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", running ? "UP" : "DOWN");
        body.put("lastPollAt", lastPollAt);
        body.put("storage", artifactStore.isHealthy() ? "UP" : "DOWN");

        return ResponseEntity.status(running ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
