package com.scout.service.pipeline;

import reactor.core.publisher.Mono;

/**
 * One opaque unit of pipeline work. Signals an error on failure.
 *
 * @param <I> input, the previous step's output
 * @param <O> output handed to the next step
 */
@FunctionalInterface
public interface StepFunction<I, O> {

    Mono<O> apply(I input);
}
