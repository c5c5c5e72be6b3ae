package com.pdm.engine.service;

import java.util.List;

/**
 * The next OEM maintenance task due for an equipment item.
 */
public record ScheduledTask(
    String task,
    double dueInHours,
    double estimatedDuration,   // h
    List<String> requiredParts
) {
    public ScheduledTask {
        requiredParts = requiredParts == null ? List.of() : List.copyOf(requiredParts);
    }
}
