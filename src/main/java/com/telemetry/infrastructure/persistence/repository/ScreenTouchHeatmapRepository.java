package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.ScreenTouchHeatmapEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.UUID;

@Repository
public interface ScreenTouchHeatmapRepository extends JpaRepository<ScreenTouchHeatmapEntity, UUID> {

    /**
     * Insert or add to a day's heatmap. Bucket maps are summed key by key in
     * SQL; an existing count is never overwritten. A {@code firstSeenMs} of 0
     * means unknown.
     */
    @Modifying
    @Query(value = "INSERT INTO screen_touch_heatmaps " +
           "(id, project_id, screen_name, date, touch_buckets, rage_tap_buckets, total_touches, total_rage_taps, " +
           " sample_session_id, screen_first_seen_ms, updated_at) " +
           "VALUES (gen_random_uuid(), :projectId, :screenName, :date, CAST(:touchBuckets AS jsonb), " +
           " CAST(:rageTapBuckets AS jsonb), :touches, :rageTaps, :sessionId, NULLIF(:firstSeenMs, 0), now()) " +
           "ON CONFLICT (project_id, screen_name, date) DO UPDATE SET " +
           "touch_buckets = (SELECT COALESCE(jsonb_object_agg(t.key, t.total), CAST('{}' AS jsonb)) FROM (" +
           "   SELECT e.key, SUM(CAST(e.value AS integer)) AS total FROM (" +
           "     SELECT * FROM jsonb_each_text(screen_touch_heatmaps.touch_buckets) " +
           "     UNION ALL SELECT * FROM jsonb_each_text(EXCLUDED.touch_buckets)) e GROUP BY e.key) t), " +
           "rage_tap_buckets = (SELECT COALESCE(jsonb_object_agg(t.key, t.total), CAST('{}' AS jsonb)) FROM (" +
           "   SELECT e.key, SUM(CAST(e.value AS integer)) AS total FROM (" +
           "     SELECT * FROM jsonb_each_text(screen_touch_heatmaps.rage_tap_buckets) " +
           "     UNION ALL SELECT * FROM jsonb_each_text(EXCLUDED.rage_tap_buckets)) e GROUP BY e.key) t), " +
           "total_touches = screen_touch_heatmaps.total_touches + EXCLUDED.total_touches, " +
           "total_rage_taps = screen_touch_heatmaps.total_rage_taps + EXCLUDED.total_rage_taps, " +
           "sample_session_id = EXCLUDED.sample_session_id, " +
           "screen_first_seen_ms = LEAST(screen_touch_heatmaps.screen_first_seen_ms, EXCLUDED.screen_first_seen_ms), " +
           "updated_at = now()",
           nativeQuery = true)
    int mergeBuckets(
            @Param("projectId") UUID projectId,
            @Param("screenName") String screenName,
            @Param("date") LocalDate date,
            @Param("touchBuckets") String touchBucketsJson,
            @Param("rageTapBuckets") String rageTapBucketsJson,
            @Param("touches") int touches,
            @Param("rageTaps") int rageTaps,
            @Param("sessionId") String sessionId,
            @Param("firstSeenMs") long firstSeenMs
    );
}
