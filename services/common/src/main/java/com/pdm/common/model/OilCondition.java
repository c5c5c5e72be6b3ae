package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall lubricant condition of an oil analysis sample.
 */
public enum OilCondition {
    GOOD("good"),
    MARGINAL("marginal"),
    CRITICAL("critical");

    private final String value;

    OilCondition(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OilCondition fromValue(String value) {
        for (OilCondition candidate : OilCondition.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown oil condition: " + value);
    }
}
