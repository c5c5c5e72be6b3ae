package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.UsageUnit;

/**
 * Estimated remaining useful life and the share of rated life it represents.
 */
public record RemainingLife(
    @JsonProperty("value")
    long value,

    @JsonProperty("unit")
    UsageUnit unit,

    @JsonProperty("percentRemaining")
    double percentRemaining
) {
    public static RemainingLife of(long value, UsageUnit unit, double percentRemaining) {
        return new RemainingLife(value, unit, Math.max(0.0, Math.min(100.0, percentRemaining)));
    }
}
