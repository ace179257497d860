package com.telemetry.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of deciding whether a session's replay is kept for viewing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromotionResult {
    private boolean promoted;
    private String reason;
    private double score;

    public static PromotionResult promoted(String reason, double score) {
        return new PromotionResult(true, reason, score);
    }

    public static PromotionResult rejected(String reason) {
        return new PromotionResult(false, reason, 0);
    }
}
