package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What one evidence source contributed to an analysis.
 */
public record SourceContribution(
    @JsonProperty("source")
    DataSource source,

    @JsonProperty("contribution")
    String contribution,

    @JsonProperty("relevanceScore")
    int relevanceScore,

    @JsonProperty("dataPoints")
    List<DataPoint> dataPoints
) {
    public SourceContribution {
        dataPoints = dataPoints == null ? List.of() : List.copyOf(dataPoints);
    }
}
