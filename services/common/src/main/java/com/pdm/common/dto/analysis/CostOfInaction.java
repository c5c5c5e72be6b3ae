package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CostOfInaction(
    @JsonProperty("amount")
    long amount,

    @JsonProperty("currency")
    String currency,

    @JsonProperty("description")
    String description
) {
}
