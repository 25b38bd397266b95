package com.scout.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized completion returned by every provider and by the inference client.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InferenceResult {

    @JsonProperty("content")
    private String content;

    @JsonProperty("usage")
    private TokenUsage usage;

    @JsonProperty("latency_ms")
    private long latencyMs;

    /**
     * Model that actually produced the completion.
     */
    @JsonProperty("model")
    private String model;

    @JsonProperty("cached")
    private boolean cached;

    @JsonProperty("retry_count")
    private int retryCount;

    @JsonProperty("fallback_used")
    private boolean fallbackUsed;

    @JsonProperty("request_id")
    private String requestId;
}
