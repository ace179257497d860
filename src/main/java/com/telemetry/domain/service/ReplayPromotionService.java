package com.telemetry.domain.service;

import com.telemetry.domain.model.FlowProfile;
import com.telemetry.domain.model.PromotionResult;
import com.telemetry.domain.service.extract.ScreenPaths;
import com.telemetry.infrastructure.cache.RedisCacheService;
import com.telemetry.infrastructure.persistence.entity.ProjectEntity;
import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import com.telemetry.infrastructure.persistence.entity.SessionMetricsEntity;
import com.telemetry.infrastructure.persistence.repository.ProjectRepository;
import com.telemetry.infrastructure.persistence.repository.SessionMetricsRepository;
import com.telemetry.infrastructure.persistence.repository.SessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.DoubleSupplier;

/**
 * Replay promotion.
 *
 * Decision order: project quota, hard thresholds, stuck on an entry screen,
 * low exploration, dropped out of the learned funnel, soft score, then
 * random sampling at the project's healthy-replay rate. Every promotion
 * reason is rate limited per project in 15 minute windows.
 */
@Slf4j
@Service
public class ReplayPromotionService implements PromotionEvaluator {

    static final Map<String, Integer> REASON_RATE_LIMITS = Map.ofEntries(
            Map.entry("crash", 100),
            Map.entry("anr", 100),
            Map.entry("high_latency", 100),
            Map.entry("slow_startup", 100),
            Map.entry("rage_tap", 1000),
            Map.entry("dead_tap", 1000),
            Map.entry("low_exploration", 200),
            Map.entry("stuck_first_screen", 200),
            Map.entry("failed_funnel", 200),
            Map.entry("score", 500),
            Map.entry("sample", 500));

    static final Duration RATE_WINDOW = Duration.ofMinutes(15);

    private final SessionRepository sessionRepository;
    private final SessionMetricsRepository metricsRepository;
    private final ProjectRepository projectRepository;
    private final FunnelAnalysisService funnelAnalysis;
    private final RedisCacheService cache;
    private final DoubleSupplier random;
    private final Clock clock;

    public ReplayPromotionService(SessionRepository sessionRepository,
                                  SessionMetricsRepository metricsRepository,
                                  ProjectRepository projectRepository,
                                  FunnelAnalysisService funnelAnalysis,
                                  RedisCacheService cache,
                                  DoubleSupplier random,
                                  Clock clock) {
        this.sessionRepository = sessionRepository;
        this.metricsRepository = metricsRepository;
        this.projectRepository = projectRepository;
        this.funnelAnalysis = funnelAnalysis;
        this.cache = cache;
        this.random = random;
        this.clock = clock;
    }

    @Override
    public PromotionResult evaluate(String sessionId, UUID projectId, int durationSeconds) {
        Optional<SessionEntity> sessionOpt = sessionRepository.findById(sessionId);
        if (sessionOpt.isEmpty()) {
            return PromotionResult.rejected("session_not_found");
        }
        SessionEntity session = sessionOpt.get();
        if (session.isReplayPromoted()) {
            String reason = session.getReplayPromotedReason() != null ? session.getReplayPromotedReason() : "already_promoted";
            double score = session.getReplayPromotionScore() != null ? session.getReplayPromotionScore() : 0;
            return new PromotionResult(true, reason, score);
        }

        SessionMetricsEntity metrics = metricsRepository.findBySessionId(sessionId)
                .orElseGet(SessionMetricsEntity::new);
        if (metrics.getScreenshotSegmentCount() == 0) {
            return PromotionResult.rejected("no_recording_data");
        }

        ProjectEntity project = projectRepository.findById(projectId)
                .orElseGet(() -> ProjectEntity.builder().id(projectId).build());

        PromotionResult result = evaluateWithQuota(projectId, project, metrics, durationSeconds);

        Instant now = clock.instant();
        if (result.isPromoted()) {
            sessionRepository.markPromoted(sessionId, result.getReason(), result.getScore(), now);
            log.info("Session {} promoted for replay: reason={}, score={}, segments={}",
                    sessionId, result.getReason(), result.getScore(), metrics.getScreenshotSegmentCount());
        } else {
            sessionRepository.updatePromotionScore(sessionId, result.getScore(), now);
            log.debug("Session {} not promoted: {}", sessionId, result.getReason());
        }
        return result;
    }

    PromotionResult evaluateWithQuota(UUID projectId, ProjectEntity project,
                                      SessionMetricsEntity metrics, int durationSeconds) {
        if (!project.isRecordingEnabled()) {
            return PromotionResult.rejected("recording_disabled");
        }
        if (durationSeconds / 60.0 > project.getMaxRecordingMinutes()) {
            return PromotionResult.rejected("quota_exceeded");
        }
        return decide(projectId, metrics, durationSeconds, project.getHealthyReplaysPromoted());
    }

    private PromotionResult decide(UUID projectId, SessionMetricsEntity metrics,
                                   int durationSeconds, double healthySampleRate) {
        String hard = PromotionScoring.hardReason(metrics);
        if (hard != null) {
            return promoteUnlessLimited(projectId, hard, 0);
        }

        List<String> screenPath = ScreenPaths.normalize(metrics.getScreensVisited(), ScreenPaths.MAX_LENGTH);

        if (isStuckOnEntryScreen(projectId, screenPath, durationSeconds)) {
            return promoteUnlessLimited(projectId, "stuck_first_screen", 0);
        }

        if (PromotionScoring.isLowExploration(ScreenPaths.uniqueCount(screenPath), durationSeconds)) {
            return promoteUnlessLimited(projectId, "low_exploration", 0);
        }

        Optional<FlowProfile> funnel = funnelAnalysis.getLearnedFunnel(projectId);
        if (funnel.isPresent() && droppedOutOfFunnel(screenPath, funnel.get().getDominantPath())) {
            return promoteUnlessLimited(projectId, "failed_funnel", 0);
        }

        double score = PromotionScoring.score(metrics, durationSeconds);
        if (score >= PromotionScoring.SCORE_THRESHOLD) {
            return promoteUnlessLimited(projectId, "score", score);
        }

        if (random.getAsDouble() < healthySampleRate) {
            return promoteUnlessLimited(projectId, "sample", score);
        }

        return new PromotionResult(false, "not_promoted", score);
    }

    private boolean isStuckOnEntryScreen(UUID projectId, List<String> screenPath, int durationSeconds) {
        if (screenPath.isEmpty()
                || screenPath.size() > PromotionScoring.MAX_SCREENS_FOR_FIRST_SCREEN
                || durationSeconds < PromotionScoring.MIN_DURATION_SECONDS_FOR_FIRST_SCREEN) {
            return false;
        }
        List<String> entryScreens = funnelAnalysis.getFlowProfile(projectId)
                .map(profile -> !profile.getEntryScreens().isEmpty()
                        ? profile.getEntryScreens()
                        : profile.getDominantPath().isEmpty() ? List.<String>of() : List.of(profile.getDominantPath().get(0)))
                .orElse(List.of());
        return entryScreens.isEmpty() || entryScreens.contains(screenPath.get(0));
    }

    /**
     * True when the session entered the funnel (first steps match) but never
     * reached its last screen.
     */
    static boolean droppedOutOfFunnel(List<String> sessionPath, List<String> happyPath) {
        if (happyPath == null || happyPath.isEmpty()) {
            return false;
        }
        int minMatch = Math.min(2, happyPath.size() - 1);
        if (sessionPath.size() < minMatch) {
            return false;
        }
        for (int i = 0; i < minMatch; i++) {
            if (!sessionPath.get(i).equals(happyPath.get(i))) {
                return false;
            }
        }
        return !sessionPath.contains(happyPath.get(happyPath.size() - 1));
    }

    private PromotionResult promoteUnlessLimited(UUID projectId, String reason, double score) {
        String key = rateKey(projectId, reason);
        Integer limit = REASON_RATE_LIMITS.get(reason);
        if (limit != null && cache.counter(key) >= limit) {
            log.info("Replay rate limit hit for project {} reason {}", projectId, reason);
            return new PromotionResult(false, "rate_limited", score);
        }
        cache.increment(key, RATE_WINDOW.plusSeconds(60));
        return PromotionResult.promoted(reason, score);
    }

    private String rateKey(UUID projectId, String reason) {
        long window = clock.millis() / RATE_WINDOW.toMillis();
        return cache.key("replay_rate", projectId, reason, window);
    }
}
