package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CostRange(
    @JsonProperty("min")
    long min,

    @JsonProperty("max")
    long max,

    @JsonProperty("currency")
    String currency
) {
}
