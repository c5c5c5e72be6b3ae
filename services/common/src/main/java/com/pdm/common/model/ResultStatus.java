package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a single laboratory test result.
 */
public enum ResultStatus {
    NORMAL("normal"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    ResultStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResultStatus fromValue(String value) {
        for (ResultStatus candidate : ResultStatus.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown result status: " + value);
    }
}
