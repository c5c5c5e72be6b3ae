package com.pdm.common.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OEM scheduled maintenance task. Duration is in hours.
 */
public record MaintenanceTask(
    @JsonProperty("task")
    String task,

    @JsonProperty("intervalHours")
    int intervalHours,

    @JsonProperty("estimatedDuration")
    double estimatedDuration,

    @JsonProperty("requiredParts")
    List<String> requiredParts
) {
    public MaintenanceTask {
        requiredParts = requiredParts == null ? List.of() : List.copyOf(requiredParts);
    }
}
