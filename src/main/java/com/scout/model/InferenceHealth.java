package com.scout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Health of the inference client: provider status plus call counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InferenceHealth {

    private String status; // healthy, degraded, unavailable
    private ProviderHealth provider;
    private long totalRequests;
    private long cacheHits;
    private long totalTokens;
    private Instant lastRequestTime;
    private String lastError;
}
