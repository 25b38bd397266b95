package com.scout.model.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
