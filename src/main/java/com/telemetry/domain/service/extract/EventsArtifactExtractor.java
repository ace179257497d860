package com.telemetry.domain.service.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.domain.exception.MalformedPayloadException;
import com.telemetry.domain.exception.SessionNotFoundException;
import com.telemetry.domain.model.IssueReport;
import com.telemetry.domain.model.IssueType;
import com.telemetry.domain.service.IssueTracker;
import com.telemetry.infrastructure.async.BackgroundTaskRunner;
import com.telemetry.infrastructure.persistence.entity.AnrEntity;
import com.telemetry.infrastructure.persistence.entity.ErrorEventEntity;
import com.telemetry.infrastructure.persistence.entity.SessionMetricsEntity;
import com.telemetry.infrastructure.persistence.repository.AnrRepository;
import com.telemetry.infrastructure.persistence.repository.ApiEndpointDailyStatsRepository;
import com.telemetry.infrastructure.persistence.repository.AppDailyStatsRepository;
import com.telemetry.infrastructure.persistence.repository.ErrorEventRepository;
import com.telemetry.infrastructure.persistence.repository.ScreenTouchHeatmapRepository;
import com.telemetry.infrastructure.persistence.repository.SessionMetricsRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Events artifacts: session metadata, counters, screen path, scores,
 * heatmaps, API rollups, errors and ANRs.
 *
 * Counters go through one atomic increment; the row lock it takes is then
 * held while the screen path and scores are recomputed, so two artifacts of
 * the same session never overwrite each other's derived columns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventsArtifactExtractor implements ArtifactExtractor {

    private static final String UNKNOWN_REGION = "unknown";

    private final ObjectMapper objectMapper;
    private final SessionRepository sessionRepository;
    private final SessionMetricsRepository metricsRepository;
    private final ScreenTouchHeatmapRepository heatmapRepository;
    private final ApiEndpointDailyStatsRepository endpointStatsRepository;
    private final AppDailyStatsRepository dailyStatsRepository;
    private final ErrorEventRepository errorRepository;
    private final AnrRepository anrRepository;
    private final IssueTracker issueTracker;
    private final BackgroundTaskRunner backgroundTasks;
    private final EventStreamAnalyzer analyzer = new EventStreamAnalyzer();

    @Override
    @Transactional
    public void extract(ExtractionContext context) {
        if (context.getSession() == null) {
            throw new SessionNotFoundException(context.getJob().getSessionId());
        }
        String sessionId = context.getSession().getId();
        UUID projectId = context.getJob().getProjectId();

        JsonNode payload = parse(context.getData(), sessionId);
        JsonNode events = payload.isArray() ? payload : payload.path("events");
        JsonNode deviceInfo = payload.isObject() && payload.get("deviceInfo") != null && payload.get("deviceInfo").isObject()
                ? payload.get("deviceInfo")
                : null;

        EventStreamSummary summary = analyzer.analyze(events, deviceInfo, context.getNow());

        updateSessionMetadata(context, deviceInfo, summary);

        metricsRepository.insertIfMissing(sessionId);
        metricsRepository.addEventCounters(
                sessionId,
                summary.getTouchCount(),
                summary.getScrollCount(),
                summary.getGestureCount(),
                summary.getInputCount(),
                summary.getCustomEventCount(),
                summary.getRageTapCount(),
                summary.getDeadTapCount(),
                summary.getErrorCount(),
                summary.getAnrCount(),
                summary.getApiTotalCount(),
                summary.getApiSuccessCount(),
                summary.getApiErrorCount(),
                summary.getApiLatencySum(),
                summary.getApiLatencySamples(),
                context.getData().length);

        SessionMetricsEntity metrics = metricsRepository.lockBySessionId(sessionId)
                .orElseThrow(() -> new IllegalStateException("Metrics row vanished for session " + sessionId));
        mergeDerivedColumns(metrics, summary, deviceInfo);
        metricsRepository.save(metrics);

        LocalDate today = LocalDate.ofInstant(context.getNow(), ZoneOffset.UTC);
        saveEndpointStats(projectId, today, summary);
        saveHeatmaps(projectId, sessionId, today, summary);
        saveErrors(context, deviceInfo, summary);
        saveAnrs(context, deviceInfo, summary);

        if (summary.getErrorCount() > 0 || summary.getAnrCount() > 0) {
            dailyStatsRepository.increment(projectId, today, 0, summary.getAnrCount(), summary.getErrorCount());
        }

        log.debug("Events artifact processed for session {}: events={}, touches={}, rageTaps={}",
                sessionId, events.size(), summary.getTouchCount(), summary.getRageTapCount());
    }

    private JsonNode parse(byte[] data, String sessionId) {
        try {
            JsonNode payload = objectMapper.readTree(data);
            if (payload == null || !(payload.isObject() || payload.isArray())) {
                throw new MalformedPayloadException("Events payload for session " + sessionId + " is not a JSON document", null);
            }
            return payload;
        } catch (IOException e) {
            throw new MalformedPayloadException("Unreadable events payload for session " + sessionId, e);
        }
    }

    private void updateSessionMetadata(ExtractionContext context, JsonNode deviceInfo, EventStreamSummary summary) {
        if (deviceInfo == null && summary.getUserDisplayId() == null && summary.getAnonymousDisplayId() == null) {
            return;
        }
        String deviceId = firstText(deviceInfo, "deviceId", "vendorId", "deviceHash");
        sessionRepository.updateDeviceInfo(
                context.getSession().getId(),
                EventStreamAnalyzer.text(deviceInfo, "appVersion"),
                EventStreamAnalyzer.text(deviceInfo, "model"),
                EventStreamAnalyzer.text(deviceInfo, "platform"),
                firstText(deviceInfo, "systemVersion", "osVersion"),
                deviceId,
                summary.getUserDisplayId(),
                summary.getAnonymousDisplayId(),
                context.getNow());
    }

    private void mergeDerivedColumns(SessionMetricsEntity metrics, EventStreamSummary summary, JsonNode deviceInfo) {
        List<String> path = ScreenPaths.normalize(summary.getScreenPath(), ScreenPaths.MAX_LENGTH);
        if (!path.isEmpty()) {
            metrics.setScreensVisited(ScreenPaths.merge(metrics.getScreensVisited(), path, ScreenPaths.MAX_LENGTH));
        }
        if (summary.getAppStartupTimeMs() != null) {
            metrics.setAppStartupTimeMs(summary.getAppStartupTimeMs());
        }
        String networkType = EventStreamAnalyzer.text(deviceInfo, "networkType");
        if (networkType != null) {
            metrics.setNetworkType(networkType);
            metrics.setCellularGeneration(EventStreamAnalyzer.text(deviceInfo, "cellularGeneration"));
            metrics.setConstrained(deviceInfo.path("isConstrained").asBoolean(false));
            metrics.setExpensive(deviceInfo.path("isExpensive").asBoolean(false));
        }
        UxScores.apply(metrics);
    }

    private void saveEndpointStats(UUID projectId, LocalDate date, EventStreamSummary summary) {
        summary.getEndpointStats().forEach((endpoint, stats) ->
                endpointStatsRepository.increment(projectId, date, endpoint, UNKNOWN_REGION,
                        stats.getCalls(), stats.getErrors(), Math.round(stats.getLatencySum())));
    }

    private void saveHeatmaps(UUID projectId, String sessionId, LocalDate date, EventStreamSummary summary) {
        summary.getHeatmaps().forEach((screen, heatmap) -> {
            if (!heatmap.hasData()) {
                return;
            }
            heatmapRepository.mergeBuckets(
                    projectId,
                    screen,
                    date,
                    toJson(heatmap.getTouchBuckets()),
                    toJson(heatmap.getRageTapBuckets()),
                    heatmap.getTotalTouches(),
                    heatmap.getTotalRageTaps(),
                    sessionId,
                    heatmap.getFirstSeenMs() != null ? heatmap.getFirstSeenMs() : 0L);
        });
    }

    private void saveErrors(ExtractionContext context, JsonNode deviceInfo, EventStreamSummary summary) {
        UUID projectId = context.getJob().getProjectId();
        String sessionId = context.getSession().getId();
        for (EventStreamSummary.ErrorOccurrence error : summary.getErrors()) {
            errorRepository.save(ErrorEventEntity.builder()
                    .sessionId(sessionId)
                    .projectId(projectId)
                    .timestamp(error.getTimestamp())
                    .errorType(error.getErrorType())
                    .errorName(error.getErrorName())
                    .message(error.getMessage())
                    .stack(error.getStack())
                    .screenName(error.getScreenName())
                    .deviceModel(orUnknown(EventStreamAnalyzer.text(deviceInfo, "model")))
                    .osVersion(orUnknown(firstText(deviceInfo, "systemVersion", "osVersion")))
                    .appVersion(orUnknown(EventStreamAnalyzer.text(deviceInfo, "appVersion")))
                    .fingerprint(Fingerprints.occurrence(projectId, error.getErrorName(), error.getMessage()))
                    .build());

            IssueReport report = IssueReport.builder()
                    .projectId(projectId)
                    .sessionId(sessionId)
                    .type(IssueType.ERROR)
                    .name(error.getErrorName())
                    .message(error.getMessage())
                    .stackTrace(error.getStack())
                    .screenName(error.getScreenName())
                    .timestamp(error.getTimestamp())
                    .build();
            backgroundTasks.submit("issue-tracking", () -> issueTracker.track(report));
        }
    }

    private void saveAnrs(ExtractionContext context, JsonNode deviceInfo, EventStreamSummary summary) {
        UUID projectId = context.getJob().getProjectId();
        String sessionId = context.getSession().getId();
        for (EventStreamSummary.AnrOccurrence anr : summary.getAnrs()) {
            Map<String, Object> deviceMetadata = new HashMap<>();
            putIfPresent(deviceMetadata, "model", EventStreamAnalyzer.text(deviceInfo, "model"));
            putIfPresent(deviceMetadata, "osVersion", firstText(deviceInfo, "systemVersion", "osVersion"));
            putIfPresent(deviceMetadata, "appVersion", EventStreamAnalyzer.text(deviceInfo, "appVersion"));
            putIfPresent(deviceMetadata, "stack", anr.getStack());
            putIfPresent(deviceMetadata, "screenName", anr.getScreenName());

            anrRepository.save(AnrEntity.builder()
                    .sessionId(sessionId)
                    .projectId(projectId)
                    .timestamp(anr.getTimestamp())
                    .durationMs(anr.getDurationMs())
                    .threadState(anr.getThreadState())
                    .fingerprint(Fingerprints.occurrence(projectId, "ANR", anr.getThreadState()))
                    .deviceMetadata(deviceMetadata)
                    .build());

            IssueReport report = IssueReport.builder()
                    .projectId(projectId)
                    .sessionId(sessionId)
                    .type(IssueType.ANR)
                    .name("ANR")
                    .message("App not responding for " + anr.getDurationMs() + "ms")
                    .stackTrace(anr.getThreadState())
                    .screenName(anr.getScreenName())
                    .timestamp(anr.getTimestamp())
                    .build();
            backgroundTasks.submit("issue-tracking", () -> issueTracker.track(report));
        }
    }

    private String toJson(Map<String, Integer> buckets) {
        try {
            return objectMapper.writeValueAsString(buckets);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize heatmap buckets", e);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = EventStreamAnalyzer.text(node, field);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static String orUnknown(String value) {
        return value != null ? value : "unknown";
    }
}
