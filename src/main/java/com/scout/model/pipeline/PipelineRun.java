package com.scout.model.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable record of one pipeline execution, successful or not.
 * Step results are in execution order; steps after a failure are absent.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineRun {

    @JsonProperty("pipeline_id")
    String pipelineId;

    @JsonProperty("pipeline_name")
    String pipelineName;

    @JsonProperty("status")
    PipelineStatus status;

    @JsonProperty("failed_step")
    String failedStep;

    @JsonProperty("error")
    String error;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("total_duration_ms")
    long totalDurationMs;

    @Singular
    @JsonProperty("steps")
    List<StepResult> steps;

    /**
     * Output of the last step that ran; null for failed runs.
     */
    @JsonIgnore
    Object output;

    @JsonIgnore
    public boolean isSuccess() {
        return status == PipelineStatus.COMPLETED;
    }

    public Optional<StepResult> getStepResult(String stepName) {
        return steps.stream()
                .filter(step -> step.getStepName().equals(stepName))
                .findFirst();
    }

    /**
     * Terminal output cast to the pipeline's output type.
     */
    public <T> Optional<T> getOutputAs(Class<T> type) {
        return type.isInstance(output) ? Optional.of(type.cast(output)) : Optional.empty();
    }
}
