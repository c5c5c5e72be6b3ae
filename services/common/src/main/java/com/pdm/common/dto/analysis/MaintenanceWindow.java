package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record MaintenanceWindow(
    @JsonProperty("start")
    Instant start,

    @JsonProperty("end")
    Instant end
) {
}
