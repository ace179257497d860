package com.telemetry.domain.service;

import com.telemetry.domain.model.DeviceUsageDelta;

import java.util.UUID;

public interface DeviceUsageService {

    void record(String deviceId, UUID projectId, DeviceUsageDelta delta);
}
