package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status attached to an externally reported equipment issue.
 */
public enum IssueStatus {
    CRITICAL("critical"),
    WARNING("warning"),
    MONITORING("monitoring");

    private final String value;

    IssueStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IssueStatus fromValue(String value) {
        for (IssueStatus candidate : IssueStatus.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown issue status: " + value);
    }
}
