package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.IssueEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IssueRepository extends JpaRepository<IssueEntity, UUID> {

    Optional<IssueEntity> findByProjectIdAndFingerprint(UUID projectId, String fingerprint);

    /**
     * Open an issue for a new fingerprint, or count one more occurrence.
     */
    @Modifying
    @Transactional
    @Query(value = "INSERT INTO issues (id, project_id, fingerprint, issue_type, title, subtitle, screen_name, " +
           " sample_session_id, sample_stack_trace, event_count, first_seen, last_seen) " +
           "VALUES (gen_random_uuid(), :projectId, :fingerprint, :issueType, :title, :subtitle, :screenName, " +
           " :sessionId, :stackTrace, 1, :seenAt, :seenAt) " +
           "ON CONFLICT (project_id, fingerprint) DO UPDATE SET " +
           "event_count = issues.event_count + 1, " +
           "last_seen = GREATEST(issues.last_seen, EXCLUDED.last_seen), " +
           "sample_session_id = EXCLUDED.sample_session_id",
           nativeQuery = true)
    int recordOccurrence(
            @Param("projectId") UUID projectId,
            @Param("fingerprint") String fingerprint,
            @Param("issueType") String issueType,
            @Param("title") String title,
            @Param("subtitle") String subtitle,
            @Param("screenName") String screenName,
            @Param("sessionId") String sessionId,
            @Param("stackTrace") String stackTrace,
            @Param("seenAt") Instant seenAt
    );
}
