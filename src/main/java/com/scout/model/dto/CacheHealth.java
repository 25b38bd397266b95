package com.scout.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheHealth {

    private String status; // healthy, degraded
    private boolean fileCacheAccessible;
    private CacheStats stats;
    private Instant lastCleanup;
}
