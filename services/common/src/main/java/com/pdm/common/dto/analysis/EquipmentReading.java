package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.EquipmentType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * Live readings for one equipment item on the analysed asset.
 * Every measurement is optional.
 *
 * Example JSON:
 * {
 *   "id": "crane-1-wire-rope",
 *   "name": "Main Hoist Wire Rope",
 *   "type": "wire_rope",
 *   "operatingHours": 6200,
 *   "cycleCount": 12000
 * }
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EquipmentReading(
    @NotBlank(message = "Equipment ID is required")
    @JsonProperty("id")
    String id,

    @NotBlank(message = "Equipment name is required")
    @JsonProperty("name")
    String name,

    @NotNull(message = "Equipment type is required")
    @JsonProperty("type")
    EquipmentType type,

    @DecimalMin(value = "0.0", message = "Health cannot be negative")
    @DecimalMax(value = "100.0", message = "Health cannot exceed 100")
    @JsonProperty("currentHealth")
    Double currentHealth,       // %

    @PositiveOrZero
    @JsonProperty("operatingHours")
    Double operatingHours,      // h

    @PositiveOrZero
    @JsonProperty("cycleCount")
    Long cycleCount,

    @JsonProperty("temperature")
    Double temperature,         // °C

    @PositiveOrZero
    @JsonProperty("vibration")
    Double vibration            // mm/s
) {
    @JsonCreator
    public EquipmentReading(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") EquipmentType type,
        @JsonProperty("currentHealth") Double currentHealth,
        @JsonProperty("operatingHours") Double operatingHours,
        @JsonProperty("cycleCount") Long cycleCount,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("vibration") Double vibration
    ) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.currentHealth = currentHealth;
        this.operatingHours = operatingHours;
        this.cycleCount = cycleCount;
        this.temperature = temperature;
        this.vibration = vibration;
    }

    public double operatingHoursOrZero() {
        return operatingHours != null ? operatingHours : 0.0;
    }

    public boolean hasOperatingHours() {
        return operatingHours != null && operatingHours > 0;
    }

    public boolean hasCycleCount() {
        return cycleCount != null && cycleCount > 0;
    }

    public boolean hasVibration() {
        return vibration != null && vibration > 0;
    }

    public boolean hasTemperature() {
        return temperature != null && temperature > 0;
    }
}
