package com.telemetry.domain.service.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.telemetry.domain.model.IssueReport;
import com.telemetry.domain.model.IssueType;
import com.telemetry.domain.service.IssueTracker;
import com.telemetry.infrastructure.async.BackgroundTaskRunner;
import com.telemetry.infrastructure.persistence.entity.CrashEntity;
import com.telemetry.infrastructure.persistence.repository.AppDailyStatsRepository;
import com.telemetry.infrastructure.persistence.repository.CrashRepository;
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
public class CrashArtifactExtractor implements ArtifactExtractor {

    private static final String UNKNOWN_EXCEPTION = "Unknown Exception";

    private final IncidentPayloads payloads;
    private final CrashRepository crashRepository;
    private final SessionMetricsRepository metricsRepository;
    private final AppDailyStatsRepository dailyStatsRepository;
    private final IssueTracker issueTracker;
    private final BackgroundTaskRunner backgroundTasks;

    @Override
    @Transactional
    public void extract(ExtractionContext context) {
        JsonNode payload = payloads.parse(context.getData(), "crashes");
        List<JsonNode> crashes = IncidentPayloads.records(payload, "crashes");
        String sessionId = payloads.resolveSessionId(context, payload, "ios");
        UUID projectId = context.getJob().getProjectId();
        String objectKey = context.getArtifact() != null ? context.getArtifact().getObjectKey() : context.getJob().getPayloadRef();

        for (JsonNode crash : crashes) {
            String exceptionName = text(crash, "exceptionName", UNKNOWN_EXCEPTION);
            String reason = EventStreamAnalyzer.text(crash, "reason");
            String stackTrace = IncidentPayloads.stackTrace(crash);
            Instant timestamp = IncidentPayloads.timestamp(crash, context.getNow());

            crashRepository.save(CrashEntity.builder()
                    .sessionId(sessionId)
                    .projectId(projectId)
                    .timestamp(timestamp)
                    .exceptionName(exceptionName)
                    .reason(reason)
                    .stackTrace(stackTrace)
                    .fingerprint(Fingerprints.occurrence(projectId, exceptionName, reason))
                    .objectKey(objectKey)
                    .deviceMetadata(payloads.deviceMetadata(crash))
                    .build());

            IssueReport report = IssueReport.builder()
                    .projectId(projectId)
                    .sessionId(sessionId)
                    .type(IssueType.CRASH)
                    .name(exceptionName)
                    .message(reason)
                    .stackTrace(stackTrace)
                    .timestamp(timestamp)
                    .build();
            backgroundTasks.submit("issue-tracking", () -> issueTracker.track(report));
        }

        metricsRepository.addCrashes(sessionId, crashes.size());
        dailyStatsRepository.increment(projectId, LocalDate.ofInstant(context.getNow(), ZoneOffset.UTC), crashes.size(), 0, 0);
        log.debug("Crashes artifact processed for session {}: {} crashes", sessionId, crashes.size());
    }

    private static String text(JsonNode node, String field, String fallback) {
        String value = EventStreamAnalyzer.text(node, field);
        return value == null || value.isEmpty() ? fallback : value;
    }
}
