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
 * On-disk layout of one month of entries, active or archived.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsShard {

    /**
     * Year-month, e.g. 2025-03.
     */
    @JsonProperty("month")
    private String month;

    /**
     * Set on archive shards only.
     */
    @JsonProperty("archived_at")
    private Instant archivedAt;

    @JsonProperty("entries")
    @Builder.Default
    private List<MetricsEntry> entries = new ArrayList<>();
}
