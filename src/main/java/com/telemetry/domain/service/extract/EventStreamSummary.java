package com.telemetry.domain.service.extract;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one events artifact contributes, before it is written anywhere.
 */
@Data
public class EventStreamSummary {

    private int touchCount;
    private int scrollCount;
    private int gestureCount;
    private int inputCount;
    private int customEventCount;
    private int rageTapCount;
    private int deadTapCount;
    private int errorCount;

    private int apiTotalCount;
    private int apiSuccessCount;
    private int apiErrorCount;
    private double apiLatencySum;
    private long apiLatencySamples;

    private Double appStartupTimeMs;
    private String userDisplayId;
    private String anonymousDisplayId;

    private final List<String> screenPath = new ArrayList<>();
    private final Map<String, ScreenHeatmap> heatmaps = new LinkedHashMap<>();
    private final Map<String, EndpointStats> endpointStats = new LinkedHashMap<>();
    private final List<ErrorOccurrence> errors = new ArrayList<>();
    private final List<AnrOccurrence> anrs = new ArrayList<>();

    public int getAnrCount() {
        return anrs.size();
    }

    ScreenHeatmap heatmapFor(String screen) {
        return heatmaps.computeIfAbsent(screen, s -> new ScreenHeatmap());
    }

    @Data
    public static class ScreenHeatmap {
        private final Map<String, Integer> touchBuckets = new HashMap<>();
        private final Map<String, Integer> rageTapBuckets = new HashMap<>();
        private int totalTouches;
        private int totalRageTaps;
        private Long firstSeenMs;

        void addTouch(String bucket) {
            touchBuckets.merge(bucket, 1, Integer::sum);
            totalTouches++;
        }

        void addRageTap(String bucket) {
            rageTapBuckets.merge(bucket, 1, Integer::sum);
            totalRageTaps++;
        }

        public boolean hasData() {
            return totalTouches > 0 || totalRageTaps > 0;
        }
    }

    @Data
    public static class EndpointStats {
        private long calls;
        private long errors;
        private double latencySum;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorOccurrence {
        private Instant timestamp;
        private String errorType;
        private String errorName;
        private String message;
        private String stack;
        private String screenName;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnrOccurrence {
        private Instant timestamp;
        private long durationMs;
        private String threadState;
        private String stack;
        private String screenName;
    }
}
