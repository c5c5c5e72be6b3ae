package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.AssetType;
import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.Priority;
import lombok.Builder;

import java.util.List;

/**
 * Maintenance recommendation for one equipment item.
 */
@Builder
public record Prediction(
    @JsonProperty("id")
    String id,

    @JsonProperty("equipmentId")
    String equipmentId,

    @JsonProperty("equipmentName")
    String equipmentName,

    @JsonProperty("equipmentType")
    EquipmentType equipmentType,

    @JsonProperty("assetType")
    AssetType assetType,

    @JsonProperty("assetId")
    String assetId,

    @JsonProperty("assetName")
    String assetName,

    @JsonProperty("priority")
    Priority priority,

    @JsonProperty("title")
    String title,

    @JsonProperty("description")
    String description,

    @JsonProperty("predictedIssue")
    String predictedIssue,

    @JsonProperty("healthScore")
    double healthScore,

    @JsonProperty("remainingLife")
    RemainingLife remainingLife,

    @JsonProperty("confidence")
    int confidence,

    @JsonProperty("recommendedAction")
    String recommendedAction,

    @JsonProperty("alternativeActions")
    List<String> alternativeActions,

    @JsonProperty("costOfInaction")
    CostOfInaction costOfInaction,

    @JsonProperty("estimatedRepairCost")
    CostRange estimatedRepairCost,

    @JsonProperty("estimatedDowntime")
    DowntimeRange estimatedDowntime,

    @JsonProperty("partsRequired")
    List<String> partsRequired,

    @JsonProperty("optimalMaintenanceWindow")
    MaintenanceWindow optimalMaintenanceWindow
) {
    public Prediction {
        alternativeActions = alternativeActions == null ? List.of() : List.copyOf(alternativeActions);
        partsRequired = partsRequired == null ? List.of() : List.copyOf(partsRequired);
    }
}
