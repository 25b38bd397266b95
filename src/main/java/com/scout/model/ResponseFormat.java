package com.scout.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output format requested from the provider.
 */
public enum ResponseFormat {
    TEXT,
    JSON;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ResponseFormat fromValue(String value) {
        for (ResponseFormat format : values()) {
            if (format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown response format: " + value);
    }
}
