package com.scout.model.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk layout of the rolling system metrics window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemMetricsSeries {

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("interval_seconds")
    private long intervalSeconds;

    @JsonProperty("max_age_hours")
    private long maxAgeHours;

    @JsonProperty("points")
    @Builder.Default
    private List<SystemMetricsPoint> points = new ArrayList<>();
}
