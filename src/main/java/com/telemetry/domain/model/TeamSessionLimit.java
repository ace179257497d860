package com.telemetry.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Cached view of a team's session usage for one billing period ({@code yyyy-MM}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamSessionLimit {
    private UUID teamId;
    private String period;
    private long sessionsUsed;
    private long sessionLimit;
    private String planName;

    public boolean isExceeded() {
        return sessionLimit > 0 && sessionsUsed >= sessionLimit;
    }
}
