package com.scout.model.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated statistics for one calling module.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModuleStats {

    @JsonProperty("module_name")
    private String moduleName;

    @JsonProperty("total_calls")
    private int totalCalls;

    @JsonProperty("success_count")
    private int successCount;

    @JsonProperty("total_duration_seconds")
    private double totalDurationSeconds;

    @JsonProperty("avg_tokens_per_second")
    private double avgTokensPerSecond;

    @JsonProperty("success_rate")
    public double getSuccessRate() {
        if (totalCalls == 0) {
            return 0.0;
        }
        return (successCount * 100.0) / totalCalls;
    }

    @JsonProperty("avg_duration_seconds")
    public double getAvgDurationSeconds() {
        if (successCount == 0) {
            return 0.0;
        }
        return totalDurationSeconds / successCount;
    }
}
