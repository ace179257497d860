package com.telemetry.infrastructure.storage;

import com.telemetry.domain.model.ArtifactKind;

import java.util.UUID;

/**
 * Object key layout: {@code tenant/{teamId}/project/{projectId}/sessions/{sessionId}/{kind}/{filename}}.
 */
public final class ObjectKeys {

    private ObjectKeys() {
    }

    public static String artifactKey(UUID teamId, UUID projectId, String sessionId, ArtifactKind kind, String filename) {
        return projectPrefix(teamId, projectId) + "sessions/" + sessionId + "/" + kind.pathSegment() + "/" + filename;
    }

    public static String projectPrefix(UUID teamId, UUID projectId) {
        return "tenant/" + teamId + "/project/" + projectId + "/";
    }

    /**
     * Only screenshot archives may be removed by the retention sweep.
     */
    public static boolean isScreenshotArchive(String key) {
        return key != null && key.contains("/screenshots/") && key.endsWith(".tar.gz");
    }
}
