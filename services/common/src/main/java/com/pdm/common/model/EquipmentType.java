package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Equipment types covered by the OEM catalog.
 */
public enum EquipmentType {
    WIRE_ROPE("wire_rope"),
    HOIST_MOTOR("hoist_motor"),
    MAIN_ENGINE("main_engine"),
    PUMP_SYSTEM("pump_system"),
    HYDRAULIC_SYSTEM("hydraulic_system"),
    GENERATOR("generator"),
    CRANE_BOOM("crane_boom"),
    SLEW_BEARING("slew_bearing");

    private final String value;

    EquipmentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Human readable form, e.g. "wire rope".
     */
    public String displayName() {
        return value.replace('_', ' ');
    }

    @JsonCreator
    public static EquipmentType fromValue(String value) {
        for (EquipmentType type : EquipmentType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown equipment type: " + value);
    }

    /**
     * Best-effort guess of the equipment type from a free-form identifier
     * such as "crane-1-wire-rope". Falls back to {@link #MAIN_ENGINE}.
     */
    public static EquipmentType inferFromIdentifier(String identifier) {
        String id = identifier == null ? "" : identifier.toLowerCase(Locale.ROOT);
        if (id.contains("wire")) {
            return WIRE_ROPE;
        }
        if (id.contains("hoist") || id.contains("motor")) {
            return HOIST_MOTOR;
        }
        if (id.contains("engine")) {
            return MAIN_ENGINE;
        }
        if (id.contains("pump")) {
            return PUMP_SYSTEM;
        }
        if (id.contains("hydraulic")) {
            return HYDRAULIC_SYSTEM;
        }
        if (id.contains("gen")) {
            return GENERATOR;
        }
        if (id.contains("boom")) {
            return CRANE_BOOM;
        }
        if (id.contains("slew")) {
            return SLEW_BEARING;
        }
        return MAIN_ENGINE;
    }
}
