package com.telemetry.domain.service.extract;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RageTapDetector.
 *
 * Window and radius edges are where the detector has historically been off by one.
 */
class RageTapDetectorTest {

    @Test
    void testOnTap_SecondTapNearbyIsRage() {
        // Given
        RageTapDetector detector = new RageTapDetector();

        // When
        boolean first = detector.onTap(1_000, 100, 200);
        boolean second = detector.onTap(1_200, 120, 210);

        // Then
        assertFalse(first);
        assertTrue(second);
    }

    @Test
    void testOnTap_TapsOutsideWindowAreNotRage() {
        // Given
        RageTapDetector detector = new RageTapDetector();
        detector.onTap(1_000, 100, 200);

        // When
        boolean late = detector.onTap(1_501, 100, 200);

        // Then
        assertFalse(late);
    }

    @Test
    void testOnTap_TapAtWindowEdgeStillCounts() {
        // Given
        RageTapDetector detector = new RageTapDetector();
        detector.onTap(1_000, 100, 200);

        // When
        boolean edge = detector.onTap(1_500, 100, 200);

        // Then
        assertTrue(edge);
    }

    @Test
    void testOnTap_DistanceCheckedPerAxis() {
        // Given
        RageTapDetector detector = new RageTapDetector();
        detector.onTap(1_000, 100, 100);

        // When
        boolean farOnY = detector.onTap(1_100, 110, 150);
        boolean diagonal = detector.onTap(1_150, 140, 140);

        // Then
        assertFalse(farOnY);
        // 40px off on both axes of the first tap is inside the box
        assertTrue(diagonal);
    }

    @Test
    void testOnTap_BurstCountsEveryTapAfterTheFirst() {
        // Given
        RageTapDetector detector = new RageTapDetector();
        int rage = 0;

        // When
        for (int i = 0; i < 4; i++) {
            if (detector.onTap(1_000 + i * 100L, 50, 50)) {
                rage++;
            }
        }

        // Then
        assertEquals(3, rage);
    }
}
