package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a measured parameter across samples.
 */
public enum Trend {
    STABLE("stable"),
    INCREASING("increasing"),
    DECREASING("decreasing");

    private final String value;

    Trend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Trend fromValue(String value) {
        for (Trend candidate : Trend.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown trend: " + value);
    }
}
