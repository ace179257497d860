package com.telemetry.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.domain.model.FlowProfile;
import com.telemetry.domain.service.extract.ScreenPaths;
import com.telemetry.infrastructure.cache.DistributedCacheLock;
import com.telemetry.infrastructure.cache.RedisCacheService;
import com.telemetry.infrastructure.persistence.repository.SessionMetricsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Learns a project's typical screen flow from the paths of recent sessions.
 *
 * Two products: a short-lived flow profile (entry screens, used to tell
 * "stuck on the first screen" apart from normal browsing) and the learned
 * funnel, kept only when it is long and common enough to be meaningful.
 */
@Slf4j
@Service
public class FunnelAnalysisService {

    static final int ANALYSIS_SAMPLE_SIZE = 1000;
    static final int FLOW_PROFILE_SAMPLE_SIZE = 750;
    static final int MIN_PATH_LENGTH = 3;
    static final double MIN_CONFIDENCE = 0.3;
    static final int MIN_FUNNEL_SAMPLE_SIZE = 50;
    static final int MIN_FLOW_PROFILE_SAMPLE_SIZE = 30;
    static final int MIN_SESSION_DURATION_SECONDS = 10;
    static final int ENTRY_SCREENS_MAX = 3;
    static final double ENTRY_SCREEN_MIN_SHARE = 0.12;
    static final int ENTRY_SCREEN_MIN_COUNT = 5;
    static final int MAX_PATH_STEPS = 5;
    static final int MAX_SCREEN_PATH_LENGTH = 10;
    static final double MIN_STEP_RETENTION = 0.1;

    static final Duration FLOW_PROFILE_TTL = Duration.ofHours(1);
    static final Duration FUNNEL_TTL = Duration.ofDays(7);
    static final Duration LOOKBACK = Duration.ofDays(30);
    private static final Duration LOCK_TTL = Duration.ofSeconds(30);

    private final SessionMetricsRepository metricsRepository;
    private final RedisCacheService cache;
    private final DistributedCacheLock cacheLock;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FunnelAnalysisService(SessionMetricsRepository metricsRepository,
                                 RedisCacheService cache,
                                 DistributedCacheLock cacheLock,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.metricsRepository = metricsRepository;
        this.cache = cache;
        this.cacheLock = cacheLock;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Cached flow profile, or empty when the project has too few sessions.
     */
    @Transactional(readOnly = true)
    public Optional<FlowProfile> getFlowProfile(UUID projectId) {
        FlowProfile profile = cacheLock.getOrLoad(
                cache.key("flow_profile", projectId),
                cache.key("flow_profile_lock", projectId),
                FlowProfile.class,
                FLOW_PROFILE_TTL,
                LOCK_TTL,
                () -> buildProfile(projectId, recentPaths(projectId, FLOW_PROFILE_SAMPLE_SIZE, 1),
                        1, MIN_FLOW_PROFILE_SAMPLE_SIZE));
        return Optional.ofNullable(profile);
    }

    /**
     * Most recently learned funnel of the project, if any.
     */
    public Optional<FlowProfile> getLearnedFunnel(UUID projectId) {
        return cache.get(cache.key("funnel", projectId), FlowProfile.class);
    }

    /**
     * Recompute the learned funnel. Kept only when the dominant path has at
     * least {@value #MIN_PATH_LENGTH} steps followed by {@value #MIN_CONFIDENCE}
     * of the sample.
     */
    @Transactional(readOnly = true)
    public Optional<FlowProfile> analyzeProjectFunnel(UUID projectId) {
        List<List<String>> paths = recentPaths(projectId, ANALYSIS_SAMPLE_SIZE, MIN_PATH_LENGTH);
        FlowProfile profile = buildProfile(projectId, paths, MIN_PATH_LENGTH, MIN_FUNNEL_SAMPLE_SIZE);
        if (profile == null) {
            log.info("Not enough data to analyze funnel for project {} ({} sessions)", projectId, paths.size());
            return Optional.empty();
        }
        if (profile.getDominantPath().size() < MIN_PATH_LENGTH) {
            log.debug("Learned path too short for project {}: {}", projectId, profile.getDominantPath());
            return Optional.empty();
        }
        if (profile.getPathConfidence() < MIN_CONFIDENCE) {
            log.info("Funnel confidence {} too low for project {}", profile.getPathConfidence(), projectId);
            return Optional.empty();
        }

        cache.set(cache.key("funnel", projectId), profile, FUNNEL_TTL);
        log.info("Funnel analysis complete for project {}: path={}, target={}, confidence={}, sample={}",
                projectId, profile.getDominantPath(), profile.targetScreen(),
                profile.getPathConfidence(), profile.getSampleSize());
        return Optional.of(profile);
    }

    private List<List<String>> recentPaths(UUID projectId, int sampleSize, int minPathLength) {
        Instant since = clock.instant().minus(LOOKBACK);
        List<String> rows = metricsRepository.findRecentScreenPaths(
                projectId, since, MIN_SESSION_DURATION_SECONDS, minPathLength, sampleSize);
        List<List<String>> paths = new ArrayList<>(rows.size());
        for (String row : rows) {
            try {
                paths.add(objectMapper.readValue(row, new TypeReference<List<String>>() { }));
            } catch (JsonProcessingException e) {
                log.debug("Skipping unreadable screen path for project {}: {}", projectId, e.getOriginalMessage());
            }
        }
        return paths;
    }

    /**
     * Prefix tree over normalized paths; null when fewer than
     * {@code minSampleSize} paths qualify.
     */
    FlowProfile buildProfile(UUID projectId, Collection<List<String>> paths, int minPathLength, int minSampleSize) {
        PathNode root = new PathNode("root");
        Map<String, Integer> entryCounts = new LinkedHashMap<>();
        int sampleSize = 0;

        for (List<String> raw : paths) {
            List<String> screens = ScreenPaths.normalize(raw, MAX_SCREEN_PATH_LENGTH);
            if (screens.size() < minPathLength) {
                continue;
            }
            sampleSize++;
            root.count++;
            entryCounts.merge(screens.get(0), 1, Integer::sum);

            PathNode node = root;
            for (String screen : screens) {
                node = node.children.computeIfAbsent(screen, PathNode::new);
                node.count++;
            }
        }

        if (sampleSize < minSampleSize || sampleSize == 0) {
            return null;
        }

        List<Map.Entry<String, Integer>> sortedEntries = entryCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .collect(Collectors.toList());

        final int sample = sampleSize;
        List<String> entryScreens = sortedEntries.stream()
                .filter(e -> e.getValue() >= ENTRY_SCREEN_MIN_COUNT
                        && (double) e.getValue() / sample >= ENTRY_SCREEN_MIN_SHARE)
                .limit(ENTRY_SCREENS_MAX)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        if (entryScreens.isEmpty() && !sortedEntries.isEmpty()) {
            entryScreens.add(sortedEntries.get(0).getKey());
        }

        Map<String, Integer> entryScreenCounts = new LinkedHashMap<>();
        for (String screen : entryScreens) {
            entryScreenCounts.put(screen, entryCounts.getOrDefault(screen, 0));
        }

        List<String> dominantPath = new ArrayList<>();
        PathNode terminal = pickDominantPath(root, dominantPath);

        return FlowProfile.builder()
                .projectId(projectId)
                .entryScreens(entryScreens)
                .entryScreenCounts(entryScreenCounts)
                .entryConfidence(sortedEntries.isEmpty() ? 0 : (double) sortedEntries.get(0).getValue() / sampleSize)
                .dominantPath(dominantPath)
                .pathConfidence(terminal != null ? (double) terminal.count / sampleSize : 0)
                .sampleSize(sampleSize)
                .computedAt(clock.instant())
                .build();
    }

    private PathNode pickDominantPath(PathNode root, List<String> path) {
        PathNode current = root;
        while (path.size() < MAX_PATH_STEPS && !current.children.isEmpty()) {
            PathNode best = null;
            for (PathNode child : current.children.values()) {
                if (best == null || child.count > best.count) {
                    best = child;
                }
            }
            double retention = current.count > 0 ? (double) best.count / current.count : 0;
            if (retention < MIN_STEP_RETENTION) {
                break;
            }
            path.add(best.screen);
            current = best;
        }
        return path.isEmpty() ? null : current;
    }

    private static final class PathNode {
        private final String screen;
        private final Map<String, PathNode> children = new LinkedHashMap<>();
        private int count;

        private PathNode(String screen) {
            this.screen = screen;
        }
    }
}
