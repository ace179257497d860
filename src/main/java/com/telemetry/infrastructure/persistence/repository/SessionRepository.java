package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.SessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Session lookups and the conditional updates used by the worker, the
 * auto-finalizer and the retention sweep.
 */
@Repository
public interface SessionRepository extends JpaRepository<SessionEntity, String> {

    /**
     * Sessions still open whose producer went quiet.
     *
     * Open and processing, started before {@code startedBefore}, newest
     * artifact older than {@code idleBefore}, and nothing left in the queue.
     */
    @Query(value = "SELECT s.* FROM sessions s " +
           "WHERE s.status = 'PROCESSING' " +
           "AND s.ended_at IS NULL " +
           "AND s.started_at < :startedBefore " +
           "AND (SELECT MAX(a.created_at) FROM recording_artifacts a WHERE a.session_id = s.id) < :idleBefore " +
           "AND NOT EXISTS (SELECT 1 FROM ingest_jobs j WHERE j.session_id = s.id " +
           "               AND j.status IN ('PENDING', 'PROCESSING')) " +
           "ORDER BY s.started_at ASC " +
           "LIMIT :limit",
           nativeQuery = true)
    List<SessionEntity> findAutoFinalizeCandidates(
            @Param("startedBefore") Instant startedBefore,
            @Param("idleBefore") Instant idleBefore,
            @Param("limit") int limit
    );

    /**
     * Close a session unless somebody already did. Returns 0 for an already
     * closed session.
     */
    @Modifying
    @Transactional
    @Query("UPDATE SessionEntity s SET s.endedAt = :endedAt, s.durationSeconds = :durationSeconds, " +
           "s.status = com.telemetry.infrastructure.persistence.entity.SessionEntity.SessionStatus.READY, " +
           "s.updatedAt = :now WHERE s.id = :id AND s.endedAt IS NULL")
    int closeIfOpen(
            @Param("id") String id,
            @Param("endedAt") Instant endedAt,
            @Param("durationSeconds") int durationSeconds,
            @Param("now") Instant now
    );

    /**
     * Move {@code endedAt} forward only.
     */
    @Modifying
    @Transactional
    @Query("UPDATE SessionEntity s SET s.endedAt = :endedAt, s.durationSeconds = :durationSeconds, s.updatedAt = :now " +
           "WHERE s.id = :id AND s.endedAt IS NOT NULL AND s.endedAt < :endedAt")
    int extendEndedAt(
            @Param("id") String id,
            @Param("endedAt") Instant endedAt,
            @Param("durationSeconds") int durationSeconds,
            @Param("now") Instant now
    );

    @Modifying
    @Transactional
    @Query("UPDATE SessionEntity s SET s.replaySegmentCount = s.replaySegmentCount + :segments, " +
           "s.replayStorageBytes = s.replayStorageBytes + :bytes, s.updatedAt = :now WHERE s.id = :id")
    int addReplayUsage(
            @Param("id") String id,
            @Param("segments") int segments,
            @Param("bytes") long bytes,
            @Param("now") Instant now
    );

    @Modifying
    @Transactional
    @Query("UPDATE SessionEntity s SET s.replayPromoted = true, s.replayPromotedReason = :reason, " +
           "s.replayPromotionScore = :score, s.replayPromotedAt = :now, s.updatedAt = :now " +
           "WHERE s.id = :id AND s.replayPromoted = false")
    int markPromoted(
            @Param("id") String id,
            @Param("reason") String reason,
            @Param("score") double score,
            @Param("now") Instant now
    );

    /**
     * Apply device metadata from an events payload. Null arguments keep the
     * stored value; a device id is only filled in when none is stored yet.
     */
    @Modifying
    @Query("UPDATE SessionEntity s SET " +
           "s.appVersion = COALESCE(:appVersion, s.appVersion), " +
           "s.deviceModel = COALESCE(:deviceModel, s.deviceModel), " +
           "s.platform = COALESCE(:platform, s.platform), " +
           "s.osVersion = COALESCE(:osVersion, s.osVersion), " +
           "s.deviceId = CASE WHEN s.deviceId IS NULL OR s.deviceId = '' THEN COALESCE(:deviceId, s.deviceId) " +
           "             ELSE s.deviceId END, " +
           "s.userDisplayId = COALESCE(:userDisplayId, s.userDisplayId), " +
           "s.anonymousDisplayId = COALESCE(:anonymousDisplayId, s.anonymousDisplayId), " +
           "s.updatedAt = :now " +
           "WHERE s.id = :id")
    int updateDeviceInfo(
            @Param("id") String id,
            @Param("appVersion") String appVersion,
            @Param("deviceModel") String deviceModel,
            @Param("platform") String platform,
            @Param("osVersion") String osVersion,
            @Param("deviceId") String deviceId,
            @Param("userDisplayId") String userDisplayId,
            @Param("anonymousDisplayId") String anonymousDisplayId,
            @Param("now") Instant now
    );

    @Modifying
    @Transactional
    @Query("UPDATE SessionEntity s SET s.replayPromotionScore = :score, s.updatedAt = :now WHERE s.id = :id")
    int updatePromotionScore(@Param("id") String id, @Param("score") double score, @Param("now") Instant now);

    /**
     * Closed sessions of one retention tier whose recordings outlived the
     * tier's window.
     */
    @Query(value = "SELECT s.* FROM sessions s " +
           "WHERE s.status = 'READY' " +
           "AND s.recording_deleted = false " +
           "AND s.retention_tier = :tier " +
           "AND COALESCE(s.ended_at, s.started_at) < :cutoff " +
           "ORDER BY s.started_at ASC " +
           "LIMIT :limit",
           nativeQuery = true)
    List<SessionEntity> findExpiredRecordings(
            @Param("tier") int tier,
            @Param("cutoff") Instant cutoff,
            @Param("limit") int limit
    );

    @Query(value = "SELECT COUNT(*) FROM sessions s JOIN projects p ON p.id = s.project_id " +
           "WHERE p.team_id = :teamId AND s.started_at >= :from AND s.started_at < :to",
           nativeQuery = true)
    long countTeamSessionsBetween(
            @Param("teamId") UUID teamId,
            @Param("from") Instant from,
            @Param("to") Instant to
    );

    @Modifying
    @Transactional
    @Query("UPDATE SessionEntity s SET s.recordingDeleted = true, s.recordingDeletedAt = :now, s.updatedAt = :now " +
           "WHERE s.id = :id")
    int markRecordingDeleted(@Param("id") String id, @Param("now") Instant now);
}
