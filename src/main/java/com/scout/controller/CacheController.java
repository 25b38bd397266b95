package com.scout.controller;

import com.scout.model.dto.CacheHealth;
import com.scout.model.dto.CacheStats;
import com.scout.service.cache.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Cache management controller.
 * Provides statistics and maintenance for the memory + file cache tiers.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cache")
public class CacheController {

    private final CacheStore cacheStore;

    public CacheController(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public Mono<ResponseEntity<CacheStats>> getStats() {
        return Mono.fromCallable(cacheStore::getStats)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<CacheHealth>> getHealth() {
        return Mono.fromCallable(cacheStore::healthCheck)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    /**
     * Clear both cache tiers.
     */
    @PostMapping("/clear")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache() {
        log.info("Cache clear requested");
        return Mono.fromCallable(cacheStore::clear)
                .subscribeOn(Schedulers.boundedElastic())
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", "success",
                        "removed", removed
                )));
    }

    /**
     * Remove expired file-tier entries now instead of waiting for the scheduled run.
     */
    @PostMapping("/cleanup")
    public Mono<ResponseEntity<Map<String, Object>>> cleanup() {
        return Mono.fromCallable(cacheStore::cleanupExpired)
                .subscribeOn(Schedulers.boundedElastic())
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", "success",
                        "removed", removed
                )));
    }
}
