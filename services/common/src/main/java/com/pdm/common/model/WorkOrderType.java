package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Work order categories: preventive (PM), corrective (CM) and inspection.
 */
public enum WorkOrderType {
    PM("PM"),
    CM("CM"),
    INSPECTION("inspection");

    private final String value;

    WorkOrderType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static WorkOrderType fromValue(String value) {
        for (WorkOrderType candidate : WorkOrderType.values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown work order type: " + value);
    }
}
