package com.pdm.common.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.EquipmentType;
import lombok.Builder;

import java.util.List;

/**
 * OEM reference data for one equipment type: specs, wear curve, failure
 * mode catalog and maintenance schedule.
 *
 * <p>The wear curve must be sorted by ascending usage with non-increasing
 * health, all health values within [0, 100]. The constructor rejects curves
 * that break this.
 */
@Builder
public record EquipmentProfile(
    @JsonProperty("id")
    String id,

    @JsonProperty("equipmentType")
    EquipmentType equipmentType,

    @JsonProperty("manufacturer")
    String manufacturer,

    @JsonProperty("model")
    String model,

    @JsonProperty("specs")
    EquipmentSpecs specs,

    @JsonProperty("wearCurve")
    List<WearPoint> wearCurve,

    @JsonProperty("failureModes")
    List<FailureMode> failureModes,

    @JsonProperty("maintenanceTasks")
    List<MaintenanceTask> maintenanceTasks
) {
    public EquipmentProfile {
        specs = specs == null ? EquipmentSpecs.empty() : specs;
        wearCurve = wearCurve == null ? List.of() : List.copyOf(wearCurve);
        failureModes = failureModes == null ? List.of() : List.copyOf(failureModes);
        maintenanceTasks = maintenanceTasks == null ? List.of() : List.copyOf(maintenanceTasks);
        validateWearCurve(equipmentType, wearCurve);
    }

    public boolean hasWearCurve() {
        return !wearCurve.isEmpty();
    }

    private static void validateWearCurve(EquipmentType type, List<WearPoint> curve) {
        WearPoint previous = null;
        for (WearPoint point : curve) {
            if (point.healthPercent() < 0 || point.healthPercent() > 100) {
                throw new IllegalArgumentException(
                        "Wear curve health out of range for " + type + ": " + point.healthPercent());
            }
            if (previous != null) {
                if (point.cycles() <= previous.cycles()) {
                    throw new IllegalArgumentException(
                            "Wear curve for " + type + " is not strictly ascending at " + point.cycles());
                }
                if (point.healthPercent() > previous.healthPercent()) {
                    throw new IllegalArgumentException(
                            "Wear curve for " + type + " gains health at " + point.cycles());
                }
            }
            previous = point;
        }
    }
}
