package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Labelled value shown next to a source contribution. The value is either
 * a number or a short text such as "N/A".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataPoint(
    @JsonProperty("label")
    String label,

    @JsonProperty("value")
    Object value,

    @JsonProperty("unit")
    String unit
) {
    public static DataPoint of(String label, Object value) {
        return new DataPoint(label, value, null);
    }

    public static DataPoint of(String label, Object value, String unit) {
        return new DataPoint(label, value, unit);
    }
}
