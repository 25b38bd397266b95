package com.scout.service.metrics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Moves entries past the retention window into archive shards while the service runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsArchivalTask {

    private final MetricsStore metricsStore;

    @Scheduled(fixedDelayString = "${scout.metrics.archive-interval:PT24H}",
            initialDelayString = "${scout.metrics.archive-interval:PT24H}")
    public void archive() {
        if (!metricsStore.isInitialized()) {
            log.debug("Metrics store not initialized, skipping archival");
            return;
        }
        int archived = metricsStore.archiveOldEntries();
        log.debug("Scheduled archival moved {} entries", archived);
    }
}
