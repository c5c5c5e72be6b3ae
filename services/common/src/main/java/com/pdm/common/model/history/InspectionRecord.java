package com.pdm.common.model.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.InspectionCondition;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Visual or NDT inspection result.
 */
@Builder
public record InspectionRecord(
    @JsonProperty("id")
    String id,

    @JsonProperty("assetId")
    String assetId,

    @JsonProperty("equipmentId")
    String equipmentId,

    @JsonProperty("date")
    Instant date,

    @JsonProperty("inspector")
    String inspector,

    @JsonProperty("findings")
    List<String> findings,

    @JsonProperty("condition")
    InspectionCondition condition,

    @JsonProperty("photosCount")
    int photosCount,

    @JsonProperty("recommendedActions")
    List<String> recommendedActions
) {
    public InspectionRecord {
        findings = findings == null ? List.of() : List.copyOf(findings);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
    }
}
