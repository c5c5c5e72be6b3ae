package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * Maintenance priority tiers. Declaration order is the sort order:
 * critical first, low last.
 */
public enum Priority {
    CRITICAL("critical", "Immediate Action Required", 3.0),
    HIGH("high", "Maintenance Due Soon", 2.0),
    MEDIUM("medium", "Schedule Maintenance", 1.5),
    LOW("low", "Monitor Condition", 1.0);

    /**
     * Most severe first.
     */
    public static final Comparator<Priority> BY_SEVERITY = Comparator.comparingInt(Priority::ordinal);

    private final String value;
    private final String headline;
    private final double costMultiplier;

    Priority(String value, String headline, double costMultiplier) {
        this.value = value;
        this.headline = headline;
        this.costMultiplier = costMultiplier;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getHeadline() {
        return headline;
    }

    /**
     * Scaling applied to repair cost, downtime and cost of inaction.
     */
    public double getCostMultiplier() {
        return costMultiplier;
    }

    @JsonCreator
    public static Priority fromValue(String value) {
        for (Priority priority : Priority.values()) {
            if (priority.value.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }
}
