package com.telemetry.domain.service.extract;

import com.telemetry.infrastructure.persistence.entity.SessionMetricsEntity;

/**
 * Derived session scores, recomputed from the cumulative counters after every update.
 */
public final class UxScores {

    private UxScores() {
    }

    /**
     * 100 minus capped penalties for frustration signals, plus a small
     * engagement bonus; clamped to [0, 100].
     */
    public static double uxScore(int rageTaps, int deadTaps, int errors, int apiErrors, int touches, int scrolls) {
        double score = 100;
        score -= Math.min(rageTaps * 15, 45);
        score -= Math.min(deadTaps * 8, 24);
        score -= Math.min(errors * 10, 30);
        score -= Math.min(apiErrors * 5, 20);
        score += Math.min(touches + scrolls, 10);
        return Math.max(0, Math.min(100, Math.round(score)));
    }

    public static double interactionScore(int touches, int scrolls, int gestures) {
        return Math.min(100, touches * 2 + scrolls * 2 + gestures * 3);
    }

    public static double explorationScore(int uniqueScreens) {
        return Math.min(100, uniqueScreens * 20);
    }

    public static void apply(SessionMetricsEntity metrics) {
        metrics.setUxScore(uxScore(
                metrics.getRageTapCount(),
                metrics.getDeadTapCount(),
                metrics.getErrorCount(),
                metrics.getApiErrorCount(),
                metrics.getTouchCount(),
                metrics.getScrollCount()));
        metrics.setInteractionScore(interactionScore(
                metrics.getTouchCount(),
                metrics.getScrollCount(),
                metrics.getGestureCount()));
        metrics.setExplorationScore(explorationScore(ScreenPaths.uniqueCount(metrics.getScreensVisited())));
    }
}
