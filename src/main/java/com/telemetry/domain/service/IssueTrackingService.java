package com.telemetry.domain.service;

import com.telemetry.domain.model.IssueReport;
import com.telemetry.domain.model.IssueType;
import com.telemetry.domain.service.extract.Fingerprints;
import com.telemetry.infrastructure.persistence.repository.IssueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Upserts issues keyed by {@code (projectId, fingerprint)}; the fingerprint is
 * the SHA-256 of the occurrence's grouping key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IssueTrackingService implements IssueTracker {

    private static final int MAX_TITLE_LENGTH = 500;

    private final IssueRepository issueRepository;

    @Override
    public void track(IssueReport report) {
        String type = report.getType().dbValue();
        String groupingKey = report.getType() == IssueType.ANR
                ? Fingerprints.anrGroupingKey(report.getStackTrace())
                : Fingerprints.groupingKey(type, report.getName(), groupingSource(report));
        String title = truncate(report.getName() != null ? report.getName() : type, MAX_TITLE_LENGTH);

        try {
            issueRepository.recordOccurrence(
                    report.getProjectId(),
                    Fingerprints.sha256(groupingKey),
                    type,
                    title,
                    report.getMessage(),
                    report.getScreenName(),
                    report.getSessionId(),
                    report.getStackTrace(),
                    report.getTimestamp());
            log.debug("Tracked {} issue for project {}: {}", type, report.getProjectId(), groupingKey);
        } catch (DataAccessException e) {
            log.error("Failed to track {} issue for project {}", type, report.getProjectId(), e);
        }
    }

    private static String groupingSource(IssueReport report) {
        if (report.getType() == IssueType.CRASH && report.getStackTrace() != null) {
            return report.getStackTrace();
        }
        return report.getMessage();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
