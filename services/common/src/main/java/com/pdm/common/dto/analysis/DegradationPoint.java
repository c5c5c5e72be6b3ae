package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point on a health-over-time chart; projected points lie in the future.
 */
public record DegradationPoint(
    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("healthScore")
    double healthScore,

    @JsonProperty("isProjected")
    boolean isProjected
) {
}
