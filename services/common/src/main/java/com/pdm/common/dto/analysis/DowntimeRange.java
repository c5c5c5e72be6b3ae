package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.UsageUnit;

public record DowntimeRange(
    @JsonProperty("min")
    long min,

    @JsonProperty("max")
    long max,

    @JsonProperty("unit")
    UsageUnit unit
) {
}
