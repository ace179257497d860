package com.telemetry.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Typical screen flow of a project, learned from recent sessions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowProfile {
    private UUID projectId;

    @Builder.Default
    private List<String> entryScreens = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> entryScreenCounts = new LinkedHashMap<>();

    // Share of sampled sessions starting on the most common entry screen
    private double entryConfidence;

    @Builder.Default
    private List<String> dominantPath = new ArrayList<>();

    // Share of sampled sessions that followed the whole dominant path
    private double pathConfidence;

    private int sampleSize;
    private Instant computedAt;

    public String targetScreen() {
        return dominantPath.isEmpty() ? null : dominantPath.get(dominantPath.size() - 1);
    }
}
