package com.telemetry.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One crash, ANR or error occurrence to be grouped into an issue.
 */
@Value
@Builder
public class IssueReport {
    UUID projectId;
    String sessionId;
    IssueType type;
    String name;
    String message;
    String stackTrace;
    String screenName;
    Instant timestamp;
}
