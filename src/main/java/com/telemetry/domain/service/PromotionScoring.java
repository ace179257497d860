package com.telemetry.domain.service;

import com.telemetry.domain.service.extract.ScreenPaths;
import com.telemetry.infrastructure.persistence.entity.SessionMetricsEntity;

/**
 * Hard thresholds and the soft score used to promote replays.
 */
public final class PromotionScoring {

    public static final int CRASH_COUNT = 1;
    public static final int ANR_COUNT = 1;
    public static final double AVG_API_LATENCY_MS = 500;
    public static final double STARTUP_TIME_MS = 2000;
    public static final int RAGE_TAP_COUNT = 1;
    public static final int DEAD_TAP_COUNT = 3;
    public static final int API_ERROR_COUNT = 1;

    public static final int MIN_DURATION_SECONDS_FOR_EXPLORATION = 60;
    public static final double SCREENS_PER_MINUTE_THRESHOLD = 0.75;
    public static final int MIN_DURATION_SECONDS_FOR_FIRST_SCREEN = 20;
    public static final int MAX_SCREENS_FOR_FIRST_SCREEN = 1;

    public static final double SCORE_THRESHOLD = 0.25;

    private PromotionScoring() {
    }

    /**
     * Reason of the first hard threshold the session meets, or null.
     * API errors share the {@code high_latency} reason.
     */
    public static String hardReason(SessionMetricsEntity metrics) {
        if (metrics.getCrashCount() >= CRASH_COUNT) {
            return "crash";
        }
        if (metrics.getAnrCount() >= ANR_COUNT) {
            return "anr";
        }
        if (metrics.getApiAvgResponseMs() >= AVG_API_LATENCY_MS) {
            return "high_latency";
        }
        if (startupMs(metrics) >= STARTUP_TIME_MS) {
            return "slow_startup";
        }
        if (metrics.getRageTapCount() >= RAGE_TAP_COUNT) {
            return "rage_tap";
        }
        if (metrics.getDeadTapCount() >= DEAD_TAP_COUNT) {
            return "dead_tap";
        }
        if (metrics.getApiErrorCount() >= API_ERROR_COUNT) {
            return "high_latency";
        }
        return null;
    }

    public static boolean isLowExploration(int uniqueScreens, int durationSeconds) {
        if (durationSeconds < MIN_DURATION_SECONDS_FOR_EXPLORATION || uniqueScreens <= 0) {
            return false;
        }
        double screensPerMinute = uniqueScreens / (durationSeconds / 60.0);
        return screensPerMinute < SCREENS_PER_MINUTE_THRESHOLD;
    }

    public static double score(SessionMetricsEntity metrics, int durationSeconds) {
        double score = 0;

        if (metrics.getApiErrorCount() >= 1) {
            score += 0.4;
        }
        if (metrics.getErrorCount() >= 1) {
            score += 0.35;
        }
        if (metrics.getApiAvgResponseMs() >= 300) {
            score += 0.3;
        }
        if (startupMs(metrics) >= 1500) {
            score += 0.25;
        }
        if (durationSeconds >= 120) {
            score += 0.2;
        }
        if (metrics.getCustomEventCount() >= 2) {
            score += 0.15;
        }
        if (metrics.isConstrained()) {
            score += 0.2;
        }
        if (metrics.isExpensive()) {
            score += 0.15;
        }
        if (metrics.getTouchCount() > 0 && metrics.getTouchCount() < 5) {
            score -= 0.15;
        }

        // Interaction density, taps plus half-weighted scrolls per minute
        double minutes = durationSeconds / 60.0;
        if (minutes > 0.1) {
            double density = (metrics.getTouchCount() + metrics.getScrollCount() * 0.5) / minutes;
            if (density > 15) {
                score += 0.2;
            } else if (density > 5) {
                score += 0.1;
            }
        }

        if (metrics.getApiTotalCount() >= 3) {
            double failureRate = (double) metrics.getApiErrorCount() / metrics.getApiTotalCount();
            if (failureRate > 0.2) {
                score += 0.25;
            } else if (failureRate > 0) {
                score += 0.1;
            }
        }

        if (ScreenPaths.uniqueCount(ScreenPaths.normalize(metrics.getScreensVisited(), ScreenPaths.MAX_LENGTH)) >= 3) {
            score += 0.15;
        }

        return Math.max(0, score);
    }

    private static double startupMs(SessionMetricsEntity metrics) {
        return metrics.getAppStartupTimeMs() != null ? metrics.getAppStartupTimeMs() : 0;
    }
}
