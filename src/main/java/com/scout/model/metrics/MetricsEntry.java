package com.scout.model.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Telemetry for one inference attempt. Immutable once recorded.
 */
@Value
@Builder
@Jacksonized
public class MetricsEntry {

    /**
     * Unique per entry; archives de-duplicate on it.
     */
    @JsonProperty("id")
    String id;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("model")
    String model;

    @JsonProperty("module")
    String module;

    @JsonProperty("job_id")
    String jobId;

    @JsonProperty("duration_seconds")
    double durationSeconds;

    @JsonProperty("prompt_tokens")
    int promptTokens;

    @JsonProperty("completion_tokens")
    int completionTokens;

    @JsonProperty("success")
    boolean success;

    @JsonProperty("error_type")
    String errorType;

    /**
     * Zero-based attempt index within the call.
     */
    @JsonProperty("retry_count")
    int retryCount;

    @JsonProperty("fallback_used")
    boolean fallbackUsed;

    @JsonProperty("cpu_percent")
    Double cpuPercent;

    @JsonProperty("memory_mb")
    Double memoryMb;

    @JsonProperty("temperature_c")
    Double temperatureC;

    /**
     * Output tokens per second, 0 when no time elapsed.
     */
    @JsonIgnore
    public double getTokensPerSecond() {
        if (durationSeconds <= 0) {
            return 0.0;
        }
        return completionTokens / durationSeconds;
    }

    @JsonIgnore
    public int getTotalTokens() {
        return promptTokens + completionTokens;
    }
}
