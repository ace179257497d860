package com.telemetry.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceUsageDelta {
    private int requestCount;
    private int minutesRecorded;
}
