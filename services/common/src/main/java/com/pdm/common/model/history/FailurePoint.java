package com.pdm.common.model.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.UsageUnit;

/**
 * Average usage at which a fleet pattern led to failure.
 */
public record FailurePoint(
    @JsonProperty("value")
    long value,

    @JsonProperty("unit")
    UsageUnit unit
) {
}
