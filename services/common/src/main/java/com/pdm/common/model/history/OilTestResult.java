package com.pdm.common.model.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.ResultStatus;
import com.pdm.common.model.Trend;

/**
 * Single laboratory parameter of an oil sample, e.g. iron content in ppm.
 */
public record OilTestResult(
    @JsonProperty("parameter")
    String parameter,

    @JsonProperty("value")
    double value,

    @JsonProperty("unit")
    String unit,

    @JsonProperty("status")
    ResultStatus status,

    @JsonProperty("trend")
    Trend trend
) {
    public boolean isAbnormal() {
        return status != ResultStatus.NORMAL;
    }
}
