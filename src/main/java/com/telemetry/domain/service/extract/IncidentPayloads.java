package com.telemetry.domain.service.extract;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.domain.exception.MalformedPayloadException;
import com.telemetry.domain.exception.SessionNotFoundException;
import com.telemetry.infrastructure.cache.SessionLimitCacheService;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.repository.SessionMetricsRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Payload handling shared by the crash and ANR extractors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
class IncidentPayloads {

    private static final TypeReference<Map<String, Object>> DEVICE_METADATA = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final SessionRepository sessionRepository;
    private final SessionMetricsRepository metricsRepository;
    private final SessionLimitCacheService sessionLimits;

    JsonNode parse(byte[] data, String what) {
        try {
            JsonNode payload = objectMapper.readTree(data);
            if (payload == null || !(payload.isObject() || payload.isArray())) {
                throw new MalformedPayloadException(what + " payload is not a JSON document", null);
            }
            return payload;
        } catch (IOException e) {
            throw new MalformedPayloadException("Unreadable " + what + " payload", e);
        }
    }

    /**
     * Records of a payload sent as a wrapper object ({@code {wrapperField: [...]}}),
     * a bare array or a single object.
     */
    static List<JsonNode> records(JsonNode payload, String wrapperField) {
        List<JsonNode> records = new ArrayList<>();
        JsonNode wrapped = payload.get(wrapperField);
        if (wrapped != null && wrapped.isArray()) {
            wrapped.forEach(records::add);
        } else if (payload.isArray()) {
            payload.forEach(records::add);
        } else {
            records.add(payload);
        }
        return records;
    }

    /**
     * Session the incidents belong to. A session id inside the payload wins
     * over the job's; when no such session exists yet a placeholder is
     * created with an empty metrics row.
     */
    String resolveSessionId(ExtractionContext context, JsonNode payload, String platform) {
        String payloadSessionId = EventStreamAnalyzer.text(payload, "sessionId");
        if (payloadSessionId == null || payloadSessionId.isEmpty()) {
            if (context.getSession() == null) {
                throw new SessionNotFoundException(context.getJob().getSessionId());
            }
            metricsRepository.insertIfMissing(context.getSession().getId());
            return context.getSession().getId();
        }

        if (!sessionRepository.existsById(payloadSessionId)) {
            sessionRepository.save(SessionEntity.builder()
                    .id(payloadSessionId)
                    .projectId(context.getJob().getProjectId())
                    .status(SessionEntity.SessionStatus.PROCESSING)
                    .platform(platform)
                    .startedAt(context.getNow())
                    .createdAt(context.getNow())
                    .updatedAt(context.getNow())
                    .build());
            if (context.getProject() != null) {
                sessionLimits.invalidate(context.getProject().getTeamId());
            }
            log.info("Created placeholder session {} for project {}", payloadSessionId, context.getJob().getProjectId());
        }
        metricsRepository.insertIfMissing(payloadSessionId);
        return payloadSessionId;
    }

    static Instant timestamp(JsonNode record, Instant fallback) {
        Long millis = EventStreamAnalyzer.epochMillis(record.get("timestamp"));
        return millis != null ? Instant.ofEpochMilli(millis) : fallback;
    }

    /**
     * Stack traces arrive as an array of frame lines or a single string.
     */
    static String stackTrace(JsonNode record) {
        JsonNode stack = record.get("stackTrace");
        if (stack == null || stack.isNull()) {
            return null;
        }
        if (stack.isArray()) {
            List<String> lines = new ArrayList<>();
            stack.forEach(line -> lines.add(line.asText()));
            return String.join("\n", lines);
        }
        return stack.isTextual() ? stack.asText() : null;
    }

    Map<String, Object> deviceMetadata(JsonNode record) {
        JsonNode meta = record.get("deviceMetadata");
        if (meta == null || !meta.isObject()) {
            return null;
        }
        return objectMapper.convertValue(meta, DEVICE_METADATA);
    }
}
