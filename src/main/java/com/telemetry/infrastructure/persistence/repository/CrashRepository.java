package com.telemetry.infrastructure.persistence.repository;

import com.telemetry.infrastructure.persistence.entity.CrashEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CrashRepository extends JpaRepository<CrashEntity, UUID> {
}
