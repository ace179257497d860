package com.telemetry.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatus {
    private long pending;
    private long processing;
    private long done;
    private long dlq;
    private boolean workerRunning;
    private Instant checkedAt;
}
