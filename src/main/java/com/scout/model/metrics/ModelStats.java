package com.scout.model.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Aggregated statistics for one model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelStats {

    @JsonProperty("model_name")
    private String modelName;

    @JsonProperty("total_calls")
    private int totalCalls;

    @JsonProperty("success_count")
    private int successCount;

    @JsonProperty("total_tokens")
    private long totalTokens;

    /**
     * Summed over successful calls only.
     */
    @JsonProperty("total_duration_seconds")
    private double totalDurationSeconds;

    @JsonProperty("avg_tokens_per_second")
    private double avgTokensPerSecond;

    @JsonProperty("error_breakdown")
    @Builder.Default
    private Map<String, Integer> errorBreakdown = new HashMap<>();

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
