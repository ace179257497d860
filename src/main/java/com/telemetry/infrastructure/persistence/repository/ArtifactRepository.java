package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.domain.model.ArtifactKind;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity;
import com.telemetry.infrastructure.persistence.entity.ArtifactEntity.ArtifactStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ArtifactRepository extends JpaRepository<ArtifactEntity, UUID> {

    @Modifying
    @Transactional
    @Query("UPDATE ArtifactEntity a SET a.status = com.telemetry.infrastructure.persistence.entity.ArtifactEntity.ArtifactStatus.READY, " +
           "a.readyAt = :now WHERE a.id = :id")
    int markReady(@Param("id") UUID id, @Param("now") Instant now);

    List<ArtifactEntity> findBySessionIdAndStatus(String sessionId, ArtifactStatus status);

    List<ArtifactEntity> findBySessionIdInAndKind(Collection<String> sessionIds, ArtifactKind kind);

    /**
     * Upload time of the newest artifact of a session, or null when it has none.
     */
    @Query("SELECT MAX(a.createdAt) FROM ArtifactEntity a WHERE a.sessionId = :sessionId")
    Instant findLastCreatedAt(@Param("sessionId") String sessionId);
}
