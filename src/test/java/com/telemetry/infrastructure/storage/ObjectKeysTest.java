package com.telemetry.infrastructure.storage;

import com.telemetry.domain.model.ArtifactKind;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ObjectKeysTest {

    @Test
    void testArtifactKey_Layout() {
        // Given
        UUID teamId = UUID.fromString("00000000-0000-0000-0000-000000000001");
        UUID projectId = UUID.fromString("00000000-0000-0000-0000-000000000002");

        // When
        String key = ObjectKeys.artifactKey(teamId, projectId, "sess-1", ArtifactKind.SCREENSHOTS, "0001.tar.gz");

        // Then
        assertTrue(key.startsWith(ObjectKeys.projectPrefix(teamId, projectId)));
        assertTrue(ObjectKeys.isScreenshotArchive(key));
    }

    @Test
    void testIsScreenshotArchive_RejectsOtherKeys() {
        assertFalse(ObjectKeys.isScreenshotArchive("tenant/t/project/p/sessions/s/events/batch.json.gz"));
        assertFalse(ObjectKeys.isScreenshotArchive("tenant/t/project/p/sessions/s/screenshots/frame.jpg"));
        assertFalse(ObjectKeys.isScreenshotArchive(null));
    }
}
