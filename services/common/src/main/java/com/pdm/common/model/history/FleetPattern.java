package com.pdm.common.model.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.EquipmentType;

import java.util.List;

/**
 * Cross-fleet observation of how an equipment type tends to fail.
 */
public record FleetPattern(
    @JsonProperty("equipmentType")
    EquipmentType equipmentType,

    @JsonProperty("pattern")
    String pattern,

    @JsonProperty("occurrences")
    int occurrences,

    @JsonProperty("averageFailurePoint")
    FailurePoint averageFailurePoint,

    @JsonProperty("affectedAssets")
    List<String> affectedAssets,

    @JsonProperty("recommendedIntervention")
    String recommendedIntervention
) {
    public FleetPattern {
        affectedAssets = affectedAssets == null ? List.of() : List.copyOf(affectedAssets);
    }
}
