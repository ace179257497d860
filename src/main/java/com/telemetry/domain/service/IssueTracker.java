package com.telemetry.domain.service;

import com.telemetry.domain.model.IssueReport;

public interface IssueTracker {

    /**
     * Group the occurrence into an issue. Implementations must not throw.
     */
    void track(IssueReport report);
}
