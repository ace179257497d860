package com.telemetry.domain.service;

import com.telemetry.domain.model.DeviceUsageDelta;
import com.telemetry.infrastructure.persistence.repository.DeviceUsageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Per device, project and UTC day usage counters.
 */
@Slf4j
@Service
public class DeviceUsageRecorder implements DeviceUsageService {

    private final DeviceUsageRepository deviceUsageRepository;
    private final Clock clock;

    public DeviceUsageRecorder(DeviceUsageRepository deviceUsageRepository, Clock clock) {
        this.deviceUsageRepository = deviceUsageRepository;
        this.clock = clock;
    }

    @Override
    public void record(String deviceId, UUID projectId, DeviceUsageDelta delta) {
        if (deviceId == null || deviceId.isEmpty()) {
            return;
        }
        LocalDate period = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        deviceUsageRepository.increment(deviceId, projectId, period, delta.getRequestCount(), delta.getMinutesRecorded());
        log.debug("Device usage for {} in project {}: +{} requests, +{} minutes",
                deviceId, projectId, delta.getRequestCount(), delta.getMinutesRecorded());
    }
}
