package com.scout.service.pipeline;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scout.model.pipeline.PipelineRun;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Bounded, expiring store of finished runs for later inspection.
 */
@Slf4j
public class PipelineRunRegistry {

    private final Cache<String, PipelineRun> runs;

    public PipelineRunRegistry(int maxRuns, Duration retention) {
        this.runs = Caffeine.newBuilder()
                .maximumSize(maxRuns)
                .expireAfterWrite(retention)
                .build();
    }

    public void register(PipelineRun run) {
        runs.put(run.getPipelineId(), run);
        log.debug("Registered pipeline run {} ({})", run.getPipelineId(), run.getStatus().getValue());
    }

    public Optional<PipelineRun> find(String pipelineId) {
        return Optional.ofNullable(runs.getIfPresent(pipelineId));
    }

    /**
     * Most recent runs first.
     */
    public List<PipelineRun> recent(int limit) {
        return runs.asMap().values().stream()
                .sorted(Comparator.comparing(PipelineRun::getStartedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    public long size() {
        runs.cleanUp();
        return runs.estimatedSize();
    }
}
