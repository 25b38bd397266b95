package com.scout.model.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Throughput of the last hour compared to the hour before.
 */
public enum PerformanceTrend {
    IMPROVING("improving"),
    STABLE("stable"),
    DEGRADING("degrading");

    private final String value;

    PerformanceTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
