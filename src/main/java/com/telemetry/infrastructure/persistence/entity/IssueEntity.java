package com.telemetry.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Crash / ANR / error occurrences grouped by fingerprint.
 */
@Entity
@Table(name = "issues", uniqueConstraints = {
    @UniqueConstraint(name = "uq_issues_project_fingerprint", columnNames = {"project_id", "fingerprint"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID projectId;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(nullable = false, length = 20)
    private String issueType;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String subtitle;

    @Column
    private String screenName;

    @Column(length = 64)
    private String sampleSessionId;

    @Column(columnDefinition = "TEXT")
    private String sampleStackTrace;

    private long eventCount;

    @Column(nullable = false)
    private Instant firstSeen;

    @Column(nullable = false)
    private Instant lastSeen;
}
