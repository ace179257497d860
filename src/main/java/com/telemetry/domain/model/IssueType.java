package com.telemetry.domain.model;

import java.util.Locale;

public enum IssueType {
    ERROR,
    CRASH,
    ANR,
    RAGE_TAP;

    /**
     * Value stored in {@code issues.issue_type}.
     */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
