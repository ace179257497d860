package com.telemetry.domain.service.extract;

import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.entity.IngestJobEntity;
import com.telemetry.infrastructure.persistence.entity.ProjectEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything an extractor needs for one claimed job. {@code session} is null
 * only for crash and ANR jobs without a session id; {@code artifact} and
 * {@code project} may be null when their rows are gone.
 */
@Value
@Builder
public class ExtractionContext {
    IngestJobEntity job;
    SessionEntity session;
    ProjectEntity project;
    ArtifactEntity artifact;
    byte[] data;
    Instant now;

    public String sessionId() {
        return session != null ? session.getId() : job.getSessionId();
    }
}
