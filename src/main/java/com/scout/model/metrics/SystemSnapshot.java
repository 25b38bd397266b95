package com.scout.model.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Host readings attached to a metrics entry.
 */
@Value
@Builder
public class SystemSnapshot {

    Double cpuPercent;
    Double memoryMb;
    Double temperatureC;

    public static SystemSnapshot empty() {
        return SystemSnapshot.builder().build();
    }
}
