package com.telemetry.domain.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kind of uploaded artifact. Drives extractor dispatch and the kind segment
 * of the object key.
 */
public enum ArtifactKind {
    EVENTS("events"),
    CRASHES("crashes"),
    ANRS("anrs"),
    SCREENSHOTS("screenshots"),
    HIERARCHY("hierarchy");

    private final String pathSegment;

    ArtifactKind(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /**
     * Name used in object keys, e.g. {@code tenant/.../sessions/{id}/screenshots/...}.
     */
    public String pathSegment() {
        return pathSegment;
    }

    public static ArtifactKind fromPathSegment(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Artifact kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.pathSegment.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown artifact kind: " + value));
    }
}
