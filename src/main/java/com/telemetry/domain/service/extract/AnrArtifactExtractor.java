package com.telemetry.domain.service.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.telemetry.domain.model.IssueReport;
import com.telemetry.domain.model.IssueType;
import com.telemetry.domain.service.IssueTracker;
import com.telemetry.infrastructure.async.BackgroundTaskRunner;
import com.telemetry.infrastructure.persistence.entity.AnrEntity;
import com.telemetry.infrastructure.persistence.repository.AnrRepository;
import com.telemetry.infrastructure.persistence.repository.AppDailyStatsRepository;
import com.telemetry.infrastructure.persistence.repository.SessionMetricsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class AnrArtifactExtractor implements ArtifactExtractor {

    static final long DEFAULT_DURATION_MS = 5000;

    private final IncidentPayloads payloads;
    private final AnrRepository anrRepository;
    private final SessionMetricsRepository metricsRepository;
    private final AppDailyStatsRepository dailyStatsRepository;
    private final IssueTracker issueTracker;
    private final BackgroundTaskRunner backgroundTasks;

    @Override
    @Transactional
    public void extract(ExtractionContext context) {
        JsonNode payload = payloads.parse(context.getData(), "anrs");
        List<JsonNode> anrs = IncidentPayloads.records(payload, "anrs");
        String sessionId = payloads.resolveSessionId(context, payload, inferPlatform(anrs, payload));
        UUID projectId = context.getJob().getProjectId();
        String objectKey = context.getArtifact() != null ? context.getArtifact().getObjectKey() : context.getJob().getPayloadRef();

        for (JsonNode anr : anrs) {
            long durationMs = anr.path("durationMs").asLong(0);
            if (durationMs <= 0) {
                durationMs = DEFAULT_DURATION_MS;
            }
            String threadState = EventStreamAnalyzer.text(anr, "threadState");
            Instant timestamp = IncidentPayloads.timestamp(anr, context.getNow());

            anrRepository.save(AnrEntity.builder()
                    .sessionId(sessionId)
                    .projectId(projectId)
                    .timestamp(timestamp)
                    .durationMs(durationMs)
                    .threadState(threadState)
                    .fingerprint(Fingerprints.occurrence(projectId, "ANR", threadState))
                    .objectKey(objectKey)
                    .deviceMetadata(payloads.deviceMetadata(anr))
                    .build());

            IssueReport report = IssueReport.builder()
                    .projectId(projectId)
                    .sessionId(sessionId)
                    .type(IssueType.ANR)
                    .name("ANR")
                    .message("App not responding for " + durationMs + "ms")
                    .stackTrace(threadState)
                    .timestamp(timestamp)
                    .build();
            backgroundTasks.submit("issue-tracking", () -> issueTracker.track(report));
        }

        metricsRepository.addAnrs(sessionId, anrs.size());
        dailyStatsRepository.increment(projectId, LocalDate.ofInstant(context.getNow(), ZoneOffset.UTC), 0, anrs.size(), 0);
        log.info("ANRs artifact processed for session {}: {} ANRs", sessionId, anrs.size());
    }

    private static String inferPlatform(List<JsonNode> anrs, JsonNode payload) {
        String platform = anrs.isEmpty() ? null : EventStreamAnalyzer.text(anrs.get(0), "platform");
        if (platform == null) {
            platform = EventStreamAnalyzer.text(payload, "platform");
        }
        return platform != null ? platform : "unknown";
    }
}
