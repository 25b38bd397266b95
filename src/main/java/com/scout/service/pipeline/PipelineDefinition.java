package com.scout.service.pipeline;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, typed chain of steps.
 *
 * <pre>
 * PipelineDefinition&lt;String, Application&gt; definition = PipelineDefinition
 *         .startingWith("apply", StepDefinition.of("rinser", rinser::process))
 *         .then(StepDefinition.of("analyzer", analyzer::analyze))
 *         .then(StepDefinition.of("creator", creator::create))
 *         .thenOptional(StepDefinition.of("formatter", formatter::format))
 *         .build();
 * </pre>
 *
 * At most one step is optional and it is always the last one, so a skipped step never
 * hands an unexpected type to a successor.
 *
 * @param <I> pipeline input
 * @param <O> output of the last step
 */
@Getter
public final class PipelineDefinition<I, O> {

    private final String name;
    private final List<StepDefinition<?, ?>> steps;

    private PipelineDefinition(String name, List<StepDefinition<?, ?>> steps) {
        this.name = name;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static <I, O> Builder<I, O> startingWith(String name, StepDefinition<I, O> first) {
        return new Builder<I, O>(name, new ArrayList<>()).append(first);
    }

    public static <I, O> Builder<I, O> startingWith(String name, String stepName, StepFunction<I, O> first) {
        return startingWith(name, StepDefinition.of(stepName, first));
    }

    public int size() {
        return steps.size();
    }

    public List<String> stepNames() {
        List<String> names = new ArrayList<>();
        for (StepDefinition<?, ?> step : steps) {
            names.add(step.getName());
        }
        return names;
    }

    public static final class Builder<I, O> {

        private final String name;
        private final List<StepDefinition<?, ?>> steps;
        private boolean sealed;

        private Builder(String name, List<StepDefinition<?, ?>> steps) {
            this.name = name;
            this.steps = steps;
        }

        public <N> Builder<I, N> then(StepDefinition<O, N> step) {
            ensureOpen();
            return new Builder<I, N>(name, new ArrayList<>(steps)).append(step);
        }

        public <N> Builder<I, N> then(String stepName, StepFunction<O, N> function) {
            return then(StepDefinition.of(stepName, function));
        }

        /**
         * Add the optional final step. No further step may follow it.
         */
        public <N> Builder<I, N> thenOptional(StepDefinition<O, N> step) {
            Builder<I, N> next = then(step.asOptional());
            next.sealed = true;
            return next;
        }

        public PipelineDefinition<I, O> build() {
            return new PipelineDefinition<>(name, steps);
        }

        private Builder<I, O> append(StepDefinition<?, ?> step) {
            Set<String> names = new HashSet<>();
            for (StepDefinition<?, ?> existing : steps) {
                names.add(existing.getName());
            }
            if (!names.add(step.getName())) {
                throw new IllegalArgumentException("Duplicate step name: " + step.getName());
            }
            steps.add(step);
            return this;
        }

        private void ensureOpen() {
            if (sealed) {
                throw new IllegalStateException("The optional step must be the last step of pipeline " + name);
            }
        }
    }
}
