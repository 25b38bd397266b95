package com.scout.model.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one pipeline step. Skipped steps carry no timing.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepResult {

    @JsonProperty("step_name")
    String stepName;

    @JsonProperty("status")
    StepStatus status;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("duration_ms")
    long durationMs;

    @JsonProperty("error")
    String error;

    @JsonProperty("output_summary")
    Map<String, Object> outputSummary;
}
