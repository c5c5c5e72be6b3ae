package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.AssetType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.List;

/**
 * Request to analyse the equipment of one asset.
 *
 * Example JSON:
 * {
 *   "assetType": "crane",
 *   "assetId": "sep-450",
 *   "assetName": "SEP-450",
 *   "equipmentList": [
 *     {"id": "sep-450-wire-rope", "name": "Main Hoist Wire Rope", "type": "wire_rope", "cycleCount": 12000}
 *   ],
 *   "environmentData": {"temperature": 38, "humidity": 72}
 * }
 */
@Builder
public record AnalysisRequest(
    @NotNull(message = "Asset type is required")
    @JsonProperty("assetType")
    AssetType assetType,

    @NotBlank(message = "Asset ID is required")
    @JsonProperty("assetId")
    String assetId,

    @NotBlank(message = "Asset name is required")
    @JsonProperty("assetName")
    String assetName,

    @NotNull(message = "Equipment list is required")
    @JsonProperty("equipmentList")
    List<@Valid @NotNull EquipmentReading> equipmentList,

    @Valid
    @JsonProperty("environmentData")
    EnvironmentData environmentData
) {
    @JsonCreator
    public AnalysisRequest(
        @JsonProperty("assetType") AssetType assetType,
        @JsonProperty("assetId") String assetId,
        @JsonProperty("assetName") String assetName,
        @JsonProperty("equipmentList") List<EquipmentReading> equipmentList,
        @JsonProperty("environmentData") EnvironmentData environmentData
    ) {
        this.assetType = assetType;
        this.assetId = assetId;
        this.assetName = assetName;
        this.equipmentList = equipmentList;
        this.environmentData = environmentData;
    }
}
