package com.scout.model.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
