package com.pdm.common.model.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * OEM rated specifications. Every field is optional; a missing value means
 * the manufacturer does not publish it for this equipment type.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EquipmentSpecs(
    @JsonProperty("ratedCapacity")
    Double ratedCapacity,

    @JsonProperty("ratedCapacityUnit")
    String ratedCapacityUnit,

    @JsonProperty("maxOperatingHours")
    Integer maxOperatingHours,     // h

    @JsonProperty("maintenanceIntervalHours")
    Integer maintenanceIntervalHours,  // h

    @JsonProperty("expectedLifeCycles")
    Integer expectedLifeCycles,

    @JsonProperty("maxTemperature")
    Double maxTemperature,         // °C

    @JsonProperty("maxVibration")
    Double maxVibration,           // mm/s

    @JsonProperty("mtbf")
    Integer mtbf                   // h
) {
    public static EquipmentSpecs empty() {
        return EquipmentSpecs.builder().build();
    }
}
