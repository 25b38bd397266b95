package com.scout.model.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One sample of host health. Each reading is null when its sensor is unavailable.
 */
@Value
@Builder
@Jacksonized
public class SystemMetricsPoint {

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("cpu_percent")
    Double cpuPercent;

    @JsonProperty("memory_percent")
    Double memoryPercent;

    @JsonProperty("memory_mb")
    Double memoryMb;

    @JsonProperty("temperature_c")
    Double temperatureC;
}
