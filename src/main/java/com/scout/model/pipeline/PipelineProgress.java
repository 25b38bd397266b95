package com.scout.model.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Progress event delivered to a {@code ProgressListener} after every step transition.
 */
@Value
@Builder
public class PipelineProgress {

    @JsonProperty("pipeline_id")
    String pipelineId;

    @JsonProperty("status")
    PipelineStatus status;

    @JsonProperty("current_step")
    String currentStep;

    @JsonProperty("steps_completed")
    int stepsCompleted;

    @JsonProperty("steps_total")
    int stepsTotal;

    @JsonProperty("progress_percent")
    double progressPercent;

    @JsonProperty("message")
    String message;
}
