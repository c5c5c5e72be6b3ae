package com.pdm.common.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One point of an OEM wear curve: expected health after a given usage.
 * Usage is counted in cycles for cycle-rated equipment and in operating
 * hours otherwise.
 */
public record WearPoint(
    @JsonProperty("cycles")
    long cycles,

    @JsonProperty("healthPercent")
    double healthPercent
) {
    public static WearPoint of(long cycles, double healthPercent) {
        return new WearPoint(cycles, healthPercent);
    }
}
