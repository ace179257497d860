package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.StorageEndpointEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface StorageEndpointRepository extends JpaRepository<StorageEndpointEntity, UUID> {

    List<StorageEndpointEntity> findByProjectIdAndActiveTrueAndShadowFalseOrderByPriorityDesc(UUID projectId);

    List<StorageEndpointEntity> findByProjectIdIsNullAndActiveTrueAndShadowFalseOrderByPriorityDesc();

    List<StorageEndpointEntity> findByProjectIdAndActiveTrueAndShadowTrue(UUID projectId);

    List<StorageEndpointEntity> findByProjectIdIsNullAndActiveTrueAndShadowTrue();

    List<StorageEndpointEntity> findByProjectIdAndActiveTrue(UUID projectId);

    List<StorageEndpointEntity> findByProjectIdIsNullAndActiveTrue();
}
