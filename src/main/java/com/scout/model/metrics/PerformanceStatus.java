package com.scout.model.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time health of local inference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceStatus {

    @JsonProperty("calls_today")
    private int callsToday;

    @JsonProperty("success_rate_today")
    private double successRateToday;

    @JsonProperty("avg_tokens_per_second")
    private double avgTokensPerSecond;

    @JsonProperty("avg_duration_seconds")
    private double avgDurationSeconds;

    @JsonProperty("primary_model_success_rate")
    private double primaryModelSuccessRate;

    @JsonProperty("fallback_usage_rate")
    private double fallbackUsageRate;

    @JsonProperty("current_cpu_percent")
    private Double currentCpuPercent;

    @JsonProperty("current_memory_percent")
    private Double currentMemoryPercent;

    @JsonProperty("current_temperature")
    private Double currentTemperature;

    @JsonProperty("throttling_warning")
    private boolean throttlingWarning;

    @JsonProperty("performance_trend")
    @Builder.Default
    private PerformanceTrend performanceTrend = PerformanceTrend.STABLE;
}
