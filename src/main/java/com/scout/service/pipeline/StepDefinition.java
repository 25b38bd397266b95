package com.scout.service.pipeline;

import lombok.Getter;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Named step of a pipeline definition.
 *
 * @param <I> input type
 * @param <O> output type
 */
@Getter
public final class StepDefinition<I, O> {

    private final String name;
    private final StepFunction<I, O> function;
    private final String description;
    private final Function<O, Map<String, Object>> summarizer;
    private final boolean optional;

    private StepDefinition(String name,
                           StepFunction<I, O> function,
                           String description,
                           Function<O, Map<String, Object>> summarizer,
                           boolean optional) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name is required");
        }
        this.name = name;
        this.function = Objects.requireNonNull(function, "function");
        this.description = description;
        this.summarizer = summarizer;
        this.optional = optional;
    }

    public static <I, O> StepDefinition<I, O> of(String name, StepFunction<I, O> function) {
        return new StepDefinition<>(name, function, null, null, false);
    }

    /**
     * Message reported when the step starts, e.g. "Analyzing compatibility...".
     */
    public StepDefinition<I, O> describedAs(String message) {
        return new StepDefinition<>(name, function, message, summarizer, optional);
    }

    /**
     * Extracts the few fields of the output worth keeping in the step result.
     */
    public StepDefinition<I, O> summarizedBy(Function<O, Map<String, Object>> summary) {
        return new StepDefinition<>(name, function, description, summary, optional);
    }

    StepDefinition<I, O> asOptional() {
        return new StepDefinition<>(name, function, description, summarizer, true);
    }

    String startMessage() {
        return description != null ? description : "Running " + name + "...";
    }

    /**
     * Invoke the step; a synchronous throw or a null publisher becomes an error signal.
     */
    @SuppressWarnings("unchecked")
    Mono<Object> invoke(Object input) {
        return Mono.defer(() -> {
            Mono<O> result = function.apply((I) input);
            if (result == null) {
                return Mono.error(new IllegalStateException("Step " + name + " returned no publisher"));
            }
            return result.cast(Object.class);
        });
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> summarize(Object output) {
        if (summarizer == null || output == null) {
            return null;
        }
        return summarizer.apply((O) output);
    }
}
