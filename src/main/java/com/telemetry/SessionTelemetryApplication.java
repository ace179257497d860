package com.telemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Session Telemetry Ingest Pipeline
 *
 * Turns recorded session artifacts (event batches, crash reports, ANR
 * reports, screenshot archives, view hierarchies) that apps upload to
 * object storage into queryable per-session metrics.
 *
 * Architecture:
 * - Durable ingest job queue in PostgreSQL, polled by a bounded worker pool
 * - Per-kind extractors writing aggregates with atomic upserts
 * - Retry with exponential backoff and a dead-letter state
 * - Auto-finalizer for sessions that never reported an explicit end
 * - Multi-endpoint S3 storage with per-project routing and shadow copies
 * - Redis cache with distributed locks against stampedes
 * - Replay promotion, issue grouping and retention sweeps
 *
 * Operational surface:
 * - Read-only queue inspection under /api/v1/ingest
 * - Metrics and health through Spring Boot Actuator
 */
@SpringBootApplication
@EnableScheduling
public class SessionTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionTelemetryApplication.class, args);
    }
}
