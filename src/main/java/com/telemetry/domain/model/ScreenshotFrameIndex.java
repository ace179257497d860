package com.telemetry.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered screenshot segments of one session, as served to the replay player.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreenshotFrameIndex {
    private String sessionId;

    @Builder.Default
    private List<Segment> segments = new ArrayList<>();

    private long totalBytes;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Segment {
        private String artifactId;
        private String objectKey;
        private String endpointId;
        private Long startTime;
        private Long endTime;
        private Long sizeBytes;
    }
}
