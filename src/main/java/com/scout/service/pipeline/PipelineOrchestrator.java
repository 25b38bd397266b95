package com.scout.service.pipeline;

import com.scout.exception.StepExecutionException;
import com.scout.model.pipeline.PipelineProgress;
import com.scout.model.pipeline.PipelineRun;
import com.scout.model.pipeline.PipelineStatus;
import com.scout.model.pipeline.StepResult;
import com.scout.model.pipeline.StepStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs pipeline definitions step by step.
 *
 * Per step:
 * 1. Report a "starting" progress event
 * 2. Invoke the step with the previous output
 * 3. Append a completed or failed step result with timing
 * 4. Stop at the first failure; later steps never start
 *
 * A failed run is returned as a {@link PipelineRun}, never signalled as an error.
 * Steps are not retried here.
 */
@Slf4j
public class PipelineOrchestrator {

    private final PipelineRunRegistry registry;
    private final Clock clock;

    public PipelineOrchestrator(PipelineRunRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public <I, O> Mono<PipelineRun> execute(PipelineDefinition<I, O> definition, I input) {
        return execute(definition, input, RunOptions.defaults(), ProgressListener.NONE);
    }

    /**
     * Execute a definition once.
     *
     * @param definition steps to run
     * @param input      input of the first step
     * @param options    per-run switches
     * @param listener   progress callback, may be null
     * @return the finished run
     */
    public <I, O> Mono<PipelineRun> execute(PipelineDefinition<I, O> definition,
                                            I input,
                                            RunOptions options,
                                            ProgressListener listener) {
        return Mono.defer(() -> {
            RunState state = new RunState(definition, options != null ? options : RunOptions.defaults(),
                    listener != null ? listener : ProgressListener.NONE);

            log.info("Starting pipeline {} ({}) with steps {}", state.pipelineId, definition.getName(), definition.stepNames());
            state.report(PipelineStatus.RUNNING, null, "Starting pipeline execution");

            return runFrom(state, 0, input)
                    .onErrorResume(e -> {
                        log.error("Pipeline {} unexpected error", state.pipelineId, e);
                        state.fail(state.currentStep, "Unexpected error: " + e.getMessage());
                        return Mono.empty();
                    })
                    .then(Mono.fromCallable(state::finish))
                    .doOnNext(registry::register);
        });
    }

    private Mono<Void> runFrom(RunState state, int index, Object value) {
        List<StepDefinition<?, ?>> steps = state.definition.getSteps();
        if (index >= steps.size()) {
            state.output = value;
            return Mono.empty();
        }

        StepDefinition<?, ?> step = steps.get(index);
        if (step.isOptional() && state.options.isSkipOptional()) {
            state.skip(step);
            return runFrom(state, index + 1, value);
        }

        return Mono.defer(() -> {
                    Instant startedAt = clock.instant();
                    long startNanos = System.nanoTime();
                    state.currentStep = step.getName();
                    state.report(PipelineStatus.RUNNING, step.getName(), step.startMessage());
                    log.info("Executing {} step", step.getName());

                    return step.invoke(value)
                            .map(Optional::of)
                            .defaultIfEmpty(Optional.empty())
                            .doOnNext(output -> state.complete(step, startedAt, startNanos, output.orElse(null)))
                            .onErrorResume(e -> {
                                state.stepFailed(step, startedAt, startNanos, e);
                                return Mono.empty();
                            });
                })
                .flatMap(output -> runFrom(state, index + 1, output.orElse(null)));
    }

    /**
     * Mutable bookkeeping of one run. Steps execute sequentially, so no two threads touch it at once.
     */
    private final class RunState {

        private final String pipelineId = UUID.randomUUID().toString().substring(0, 8);
        private final PipelineDefinition<?, ?> definition;
        private final RunOptions options;
        private final ProgressListener listener;
        private final Instant startedAt = clock.instant();
        private final long startNanos = System.nanoTime();
        private final List<StepResult> results = new ArrayList<>();

        private int stepsCompleted;
        private String currentStep;
        private String failedStep;
        private String error;
        private Object output;

        RunState(PipelineDefinition<?, ?> definition, RunOptions options, ProgressListener listener) {
            this.definition = definition;
            this.options = options;
            this.listener = listener;
        }

        void complete(StepDefinition<?, ?> step, Instant stepStart, long stepStartNanos, Object stepOutput) {
            results.add(StepResult.builder()
                    .stepName(step.getName())
                    .status(StepStatus.COMPLETED)
                    .startedAt(stepStart)
                    .completedAt(clock.instant())
                    .durationMs(elapsedMillis(stepStartNanos))
                    .outputSummary(summarize(step, stepOutput))
                    .build());
            stepsCompleted++;
            report(PipelineStatus.RUNNING, step.getName(), capitalize(step.getName()) + " step completed");
        }

        void stepFailed(StepDefinition<?, ?> step, Instant stepStart, long stepStartNanos, Throwable cause) {
            StepExecutionException wrapped = new StepExecutionException(step.getName(), cause);
            results.add(StepResult.builder()
                    .stepName(step.getName())
                    .status(StepStatus.FAILED)
                    .startedAt(stepStart)
                    .completedAt(clock.instant())
                    .durationMs(elapsedMillis(stepStartNanos))
                    .error(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
                    .build());
            fail(step.getName(), wrapped.getMessage());
            log.error("Pipeline {} failed: {}", pipelineId, wrapped.getMessage());
        }

        void skip(StepDefinition<?, ?> step) {
            results.add(StepResult.builder()
                    .stepName(step.getName())
                    .status(StepStatus.SKIPPED)
                    .build());
            stepsCompleted++;
            log.info("Skipping optional {} step", step.getName());
            report(PipelineStatus.RUNNING, step.getName(), capitalize(step.getName()) + " step skipped");
        }

        void fail(String step, String message) {
            failedStep = step;
            error = message;
        }

        PipelineRun finish() {
            PipelineStatus status = error == null ? PipelineStatus.COMPLETED : PipelineStatus.FAILED;
            PipelineRun run = PipelineRun.builder()
                    .pipelineId(pipelineId)
                    .pipelineName(definition.getName())
                    .status(status)
                    .failedStep(failedStep)
                    .error(error)
                    .startedAt(startedAt)
                    .completedAt(clock.instant())
                    .totalDurationMs(elapsedMillis(startNanos))
                    .steps(results)
                    .output(status == PipelineStatus.COMPLETED ? output : null)
                    .build();

            report(status, null, status == PipelineStatus.COMPLETED ? "Pipeline completed" : "Pipeline failed");
            log.info("Pipeline {} {} in {}ms", pipelineId, status.getValue(), run.getTotalDurationMs());
            return run;
        }

        void report(PipelineStatus status, String step, String message) {
            int total = definition.size();
            PipelineProgress progress = PipelineProgress.builder()
                    .pipelineId(pipelineId)
                    .status(status)
                    .currentStep(step)
                    .stepsCompleted(stepsCompleted)
                    .stepsTotal(total)
                    .progressPercent(total == 0 ? 0.0 : stepsCompleted * 100.0 / total)
                    .message(message)
                    .build();
            try {
                listener.onProgress(progress);
            } catch (RuntimeException e) {
                log.warn("Progress callback failed for pipeline {}: {}", pipelineId, e.getMessage());
            }
        }

        private Map<String, Object> summarize(StepDefinition<?, ?> step, Object stepOutput) {
            try {
                return step.summarize(stepOutput);
            } catch (RuntimeException e) {
                log.warn("Output summary of {} step failed: {}", step.getName(), e.getMessage());
                return null;
            }
        }
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static String capitalize(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
