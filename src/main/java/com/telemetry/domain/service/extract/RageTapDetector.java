package com.telemetry.domain.service.extract;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window rage tap detection for one pass over an event stream.
 *
 * Before each check taps older than {@value #WINDOW_MS} ms are evicted. A tap
 * is a rage tap when at least one remaining tap lies within
 * {@value #RADIUS_PX} px of it on both axes.
 */
public class RageTapDetector {

    static final long WINDOW_MS = 500;
    static final double RADIUS_PX = 50;

    private final Deque<Tap> recentTaps = new ArrayDeque<>();

    /**
     * Record a tap and report whether it is a rage tap.
     */
    public boolean onTap(long timestampMs, double x, double y) {
        while (!recentTaps.isEmpty() && timestampMs - recentTaps.peekFirst().timestampMs > WINDOW_MS) {
            recentTaps.pollFirst();
        }

        boolean rage = recentTaps.stream()
                .anyMatch(tap -> Math.abs(tap.x - x) < RADIUS_PX && Math.abs(tap.y - y) < RADIUS_PX);

        recentTaps.addLast(new Tap(timestampMs, x, y));
        return rage;
    }

    private static final class Tap {
        private final long timestampMs;
        private final double x;
        private final double y;

        private Tap(long timestampMs, double x, double y) {
            this.timestampMs = timestampMs;
            this.x = x;
            this.y = y;
        }
    }
}
