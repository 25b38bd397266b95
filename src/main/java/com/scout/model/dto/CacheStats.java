package com.scout.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cache performance counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hits;
    private long misses;
    private int memoryEntries;
    private int memoryMaxEntries;
    private int fileEntries;

    public long getTotalRequests() {
        return hits + misses;
    }

    /**
     * Hit rate as a percentage (0-100).
     */
    public double getHitRate() {
        long total = getTotalRequests();
        if (total == 0) {
            return 0.0;
        }
        return (hits * 100.0) / total;
    }
}
