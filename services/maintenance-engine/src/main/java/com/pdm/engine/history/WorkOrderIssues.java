package com.pdm.engine.history;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Typical preventive and corrective work order texts for one equipment type.
 */
public record WorkOrderIssues(
    @JsonProperty("pm")
    List<String> preventive,

    @JsonProperty("cm")
    List<String> corrective
) {
    public WorkOrderIssues {
        preventive = preventive == null ? List.of() : List.copyOf(preventive);
        corrective = corrective == null ? List.of() : List.copyOf(corrective);
    }
}
