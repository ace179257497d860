package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.SessionMetricsEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Session metrics. All counters move through {@code c = c + :delta}
 * statements; callers must run inside a transaction.
 */
@Repository
public interface SessionMetricsRepository extends JpaRepository<SessionMetricsEntity, UUID> {

    Optional<SessionMetricsEntity> findBySessionId(String sessionId);

    /**
     * Row-locked read. Used after an increment in the same transaction so
     * derived columns are computed from the latest counters.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM SessionMetricsEntity m WHERE m.sessionId = :sessionId")
    Optional<SessionMetricsEntity> lockBySessionId(@Param("sessionId") String sessionId);

    @Modifying
    @Query(value = "INSERT INTO session_metrics (id, session_id) VALUES (gen_random_uuid(), :sessionId) " +
           "ON CONFLICT (session_id) DO NOTHING",
           nativeQuery = true)
    int insertIfMissing(@Param("sessionId") String sessionId);

    /**
     * Add one artifact's event counters. The latency average is merged as a
     * weighted mean over the stored and the new sample counts.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE session_metrics SET " +
           "touch_count = touch_count + :touches, " +
           "scroll_count = scroll_count + :scrolls, " +
           "gesture_count = gesture_count + :gestures, " +
           "input_count = input_count + :inputs, " +
           "custom_event_count = custom_event_count + :customEvents, " +
           "rage_tap_count = rage_tap_count + :rageTaps, " +
           "dead_tap_count = dead_tap_count + :deadTaps, " +
           "error_count = error_count + :errors, " +
           "anr_count = anr_count + :anrs, " +
           "api_total_count = api_total_count + :apiTotal, " +
           "api_success_count = api_success_count + :apiSuccess, " +
           "api_error_count = api_error_count + :apiErrors, " +
           "api_avg_response_ms = CASE WHEN api_latency_sample_count + :latencySamples > 0 " +
           "  THEN (api_avg_response_ms * api_latency_sample_count + :latencySum) " +
           "       / (api_latency_sample_count + :latencySamples) " +
           "  ELSE api_avg_response_ms END, " +
           "api_latency_sample_count = api_latency_sample_count + :latencySamples, " +
           "events_size_bytes = events_size_bytes + :eventsBytes " +
           "WHERE session_id = :sessionId",
           nativeQuery = true)
    int addEventCounters(
            @Param("sessionId") String sessionId,
            @Param("touches") int touches,
            @Param("scrolls") int scrolls,
            @Param("gestures") int gestures,
            @Param("inputs") int inputs,
            @Param("customEvents") int customEvents,
            @Param("rageTaps") int rageTaps,
            @Param("deadTaps") int deadTaps,
            @Param("errors") int errors,
            @Param("anrs") int anrs,
            @Param("apiTotal") int apiTotal,
            @Param("apiSuccess") int apiSuccess,
            @Param("apiErrors") int apiErrors,
            @Param("latencySum") double latencySum,
            @Param("latencySamples") long latencySamples,
            @Param("eventsBytes") long eventsBytes
    );

    @Modifying
    @Query(value = "UPDATE session_metrics SET crash_count = crash_count + :crashes WHERE session_id = :sessionId",
           nativeQuery = true)
    int addCrashes(@Param("sessionId") String sessionId, @Param("crashes") int crashes);

    @Modifying
    @Query(value = "UPDATE session_metrics SET anr_count = anr_count + :anrs WHERE session_id = :sessionId",
           nativeQuery = true)
    int addAnrs(@Param("sessionId") String sessionId, @Param("anrs") int anrs);

    @Modifying
    @Query(value = "UPDATE session_metrics SET " +
           "screenshot_segment_count = screenshot_segment_count + :segments, " +
           "screenshot_total_bytes = screenshot_total_bytes + :bytes " +
           "WHERE session_id = :sessionId",
           nativeQuery = true)
    int addScreenshotSegments(
            @Param("sessionId") String sessionId,
            @Param("segments") int segments,
            @Param("bytes") long bytes
    );

    @Modifying
    @Query(value = "UPDATE session_metrics SET hierarchy_snapshot_count = hierarchy_snapshot_count + :snapshots " +
           "WHERE session_id = :sessionId",
           nativeQuery = true)
    int addHierarchySnapshots(@Param("sessionId") String sessionId, @Param("snapshots") int snapshots);

    /**
     * Visited-screen sequences of a project's recent sessions, as JSON arrays.
     */
    @Query(value = "SELECT CAST(m.screens_visited AS text) FROM session_metrics m " +
           "JOIN sessions s ON s.id = m.session_id " +
           "WHERE s.project_id = :projectId " +
           "AND s.started_at >= :since " +
           "AND s.duration_seconds > :minDurationSeconds " +
           "AND jsonb_array_length(m.screens_visited) >= :minPathLength " +
           "ORDER BY s.started_at DESC " +
           "LIMIT :limit",
           nativeQuery = true)
    List<String> findRecentScreenPaths(
            @Param("projectId") UUID projectId,
            @Param("since") Instant since,
            @Param("minDurationSeconds") int minDurationSeconds,
            @Param("minPathLength") int minPathLength,
            @Param("limit") int limit
    );
}
