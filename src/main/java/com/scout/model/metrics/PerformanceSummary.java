package com.scout.model.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Statistics over a time period.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSummary {

    @JsonProperty("period_start")
    private Instant periodStart;

    @JsonProperty("period_end")
    private Instant periodEnd;

    @JsonProperty("total_calls")
    private int totalCalls;

    @JsonProperty("total_tokens")
    private long totalTokens;

    @JsonProperty("successful_calls")
    private int successfulCalls;

    @JsonProperty("avg_tokens_per_second")
    private double avgTokensPerSecond;

    @JsonProperty("median_duration_seconds")
    private double medianDurationSeconds;

    @JsonProperty("p95_duration_seconds")
    private double p95DurationSeconds;

    @JsonProperty("success_rate")
    private double successRate;

    @JsonProperty("error_breakdown")
    @Builder.Default
    private Map<String, Integer> errorBreakdown = new HashMap<>();

    @JsonProperty("fallback_rate")
    private double fallbackRate;

    @JsonProperty("model_stats")
    @Builder.Default
    private Map<String, ModelStats> modelStats = new HashMap<>();

    @JsonProperty("module_stats")
    @Builder.Default
    private Map<String, ModuleStats> moduleStats = new HashMap<>();

    @JsonProperty("avg_cpu_percent")
    private Double avgCpuPercent;

    @JsonProperty("avg_memory_mb")
    private Double avgMemoryMb;

    @JsonProperty("avg_temperature_c")
    private Double avgTemperatureC;
}
