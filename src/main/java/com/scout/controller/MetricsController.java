package com.scout.controller;

import com.scout.model.metrics.MetricsEntry;
import com.scout.model.metrics.ModelStats;
import com.scout.model.metrics.PerformanceStatus;
import com.scout.model.metrics.PerformanceSummary;
import com.scout.model.metrics.SystemMetricsPoint;
import com.scout.service.metrics.MetricsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Read-only performance metrics API.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/metrics")
public class MetricsController {

    private static final int MAX_SUMMARY_DAYS = 365;

    private final MetricsStore metricsStore;
    private final Clock clock;

    public MetricsController(MetricsStore metricsStore, Clock clock) {
        this.metricsStore = metricsStore;
        this.clock = clock;
    }

    /**
     * Today's dashboard numbers plus current system readings.
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<PerformanceStatus>> getStatus() {
        return offload(metricsStore::getStatus);
    }

    /**
     * Aggregate over the last {@code days} days.
     *
     * @param days Window length, 1 to 365 (default: 7)
     */
    @GetMapping("/summary")
    public Mono<ResponseEntity<PerformanceSummary>> getSummary(@RequestParam(defaultValue = "7") int days) {
        if (days < 1 || days > MAX_SUMMARY_DAYS) {
            return Mono.error(new IllegalArgumentException("days must be between 1 and " + MAX_SUMMARY_DAYS));
        }
        Instant end = clock.instant();
        return offload(() -> metricsStore.getSummary(end.minus(Duration.ofDays(days)), end));
    }

    @GetMapping("/comparison")
    public Mono<ResponseEntity<Map<String, ModelStats>>> getModelComparison() {
        return offload(metricsStore::getModelComparison);
    }

    /**
     * Recent entries, newest first.
     */
    @GetMapping("/entries")
    public Mono<ResponseEntity<List<MetricsEntry>>> getEntries(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return offload(() -> metricsStore.getEntries(limit, offset));
    }

    @GetMapping("/system-history")
    public Mono<ResponseEntity<List<SystemMetricsPoint>>> getSystemHistory(
            @RequestParam(defaultValue = "15") int minutes) {
        return offload(() -> metricsStore.getSystemMetricsHistory(minutes));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private static <T> Mono<ResponseEntity<T>> offload(Callable<T> query) {
        return Mono.fromCallable(query)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
