package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Condition grade recorded by an inspector.
 */
public enum InspectionCondition {
    GOOD("good"),
    FAIR("fair"),
    POOR("poor"),
    CRITICAL("critical");

    private final String value;

    InspectionCondition(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static InspectionCondition fromValue(String value) {
        for (InspectionCondition candidate : InspectionCondition.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown inspection condition: " + value);
    }
}
