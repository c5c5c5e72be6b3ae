package com.pdm.engine.catalog;

import com.pdm.common.model.EquipmentType;

/**
 * Raised when an analysis references an equipment type with no OEM profile.
 * This is a configuration error, every other fallback in the engine assumes
 * a profile exists.
 */
public class UnknownEquipmentProfileException extends RuntimeException {

    private final EquipmentType equipmentType;

    public UnknownEquipmentProfileException(EquipmentType equipmentType) {
        super("No OEM profile registered for equipment type: "
                + (equipmentType != null ? equipmentType.getValue() : null));
        this.equipmentType = equipmentType;
    }

    public EquipmentType getEquipmentType() {
        return equipmentType;
    }
}
