package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Units used for remaining life, failure points and downtime.
 */
public enum UsageUnit {
    HOURS("hours"),
    DAYS("days"),
    CYCLES("cycles"),
    MONTHS("months");

    private final String value;

    UsageUnit(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UsageUnit fromValue(String value) {
        for (UsageUnit candidate : UsageUnit.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown usage unit: " + value);
    }
}
