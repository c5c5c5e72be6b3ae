package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Operating environment reported alongside an analysis request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnvironmentData(
    @JsonProperty("temperature")
    Double temperature,     // °C

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    @JsonProperty("humidity")
    Double humidity,        // %

    @PositiveOrZero
    @JsonProperty("seaState")
    Double seaState,        // Douglas scale

    @PositiveOrZero
    @JsonProperty("windSpeed")
    Double windSpeed        // knots
) {
    @JsonCreator
    public EnvironmentData(
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("humidity") Double humidity,
        @JsonProperty("seaState") Double seaState,
        @JsonProperty("windSpeed") Double windSpeed
    ) {
        this.temperature = temperature;
        this.humidity = humidity;
        this.seaState = seaState;
        this.windSpeed = windSpeed;
    }
}
