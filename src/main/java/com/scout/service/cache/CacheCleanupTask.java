package com.scout.service.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired and unreadable records from the file tier.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheCleanupTask {

    private final CacheStore cacheStore;

    @Scheduled(fixedDelayString = "${scout.cache.cleanup-interval:PT30M}",
            initialDelayString = "${scout.cache.cleanup-interval:PT30M}")
    public void cleanup() {
        try {
            int removed = cacheStore.cleanupExpired();
            log.debug("Scheduled cache cleanup removed {} entries", removed);
        } catch (IllegalStateException e) {
            log.warn("Skipping cache cleanup: {}", e.getMessage());
        }
    }
}
