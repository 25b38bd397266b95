package com.scout.model.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one inference attempt, as reported to the metrics store.
 */
@Value
@Builder
public class RecordRequest {

    String model;
    double durationSeconds;
    int promptTokens;
    int completionTokens;
    boolean success;
    String module;
    String jobId;
    String errorType;
    int retryCount;
    boolean fallbackUsed;

    public void validate() {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model is required");
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("Duration cannot be negative");
        }
        if (promptTokens < 0 || completionTokens < 0) {
            throw new IllegalArgumentException("Token count cannot be negative");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count cannot be negative");
        }
    }
}
