package com.telemetry.domain.service;

import com.telemetry.domain.model.PromotionResult;

import java.util.UUID;

/**
 * Decides whether a finished session's replay is kept, and records the decision.
 */
public interface PromotionEvaluator {

    PromotionResult evaluate(String sessionId, UUID projectId, int durationSeconds);
}
