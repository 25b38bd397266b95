package com.scout.service.metrics;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Runs a sampling task at a fixed period on a dedicated single-thread scheduler.
 *
 * <p>A failing tick is logged and the next tick still runs. {@link #stop(Duration)}
 * cancels the interval and waits for an in-flight tick to finish.
 */
@Slf4j
public class SystemMetricsSampler {

    private final Duration interval;
    private final Runnable task;

    private Scheduler scheduler;
    private Disposable subscription;

    public SystemMetricsSampler(Duration interval, Runnable task) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sampling interval must be positive, got " + interval);
        }
        this.interval = interval;
        this.task = task;
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        scheduler = Schedulers.newSingle("system-metrics-sampler", true);
        subscription = Flux.interval(interval, scheduler)
                .subscribe(tick -> runTick(),
                        error -> log.error("System metrics sampler terminated", error));
        log.info("Started system metrics collection (interval: {}s)", interval.toSeconds());
    }

    public synchronized void stop(Duration timeout) {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
        if (scheduler != null) {
            Scheduler stopping = scheduler;
            scheduler = null;
            stopping.disposeGracefully()
                    .timeout(timeout)
                    .onErrorResume(e -> {
                        log.warn("System metrics sampler did not stop within {}ms, forcing", timeout.toMillis());
                        stopping.dispose();
                        return Mono.empty();
                    })
                    .block();
            log.debug("Stopped system metrics collection");
        }
    }

    public synchronized boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    private void runTick() {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("Error in system metrics collection: {}", e.getMessage());
        }
    }
}
