package com.scout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Health report of one provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderHealth {

    private String status; // healthy, degraded, unavailable
    private String provider;
    private String host;
    private String model;
    private String fallbackModel;
    private Integer availableModels;
    private String error;
}
