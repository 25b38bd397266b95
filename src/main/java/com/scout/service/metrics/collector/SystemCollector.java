package com.scout.service.metrics.collector;

import com.scout.model.metrics.SystemSnapshot;

/**
 * Source of host health readings. Every reading is null when unavailable.
 */
public interface SystemCollector {

    /**
     * Temperature at or above which the host is considered at risk of throttling.
     */
    double THROTTLING_THRESHOLD_C = 80.0;

    Double getCpuPercent();

    Double getMemoryPercent();

    Double getMemoryMb();

    Double getTemperature();

    default SystemSnapshot snapshot() {
        return SystemSnapshot.builder()
                .cpuPercent(getCpuPercent())
                .memoryMb(getMemoryMb())
                .temperatureC(getTemperature())
                .build();
    }

    default boolean isThrottlingRisk() {
        Double temperature = getTemperature();
        return temperature != null && temperature >= THROTTLING_THRESHOLD_C;
    }
}
