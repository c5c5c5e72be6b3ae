package com.pdm.common.model.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.OilCondition;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Lubricant condition and wear debris report for one sample.
 */
@Builder
public record OilAnalysis(
    @JsonProperty("id")
    String id,

    @JsonProperty("assetId")
    String assetId,

    @JsonProperty("equipmentId")
    String equipmentId,

    @JsonProperty("date")
    Instant date,

    @JsonProperty("lab")
    String lab,

    @JsonProperty("results")
    List<OilTestResult> results,

    @JsonProperty("overallCondition")
    OilCondition overallCondition,

    @JsonProperty("recommendation")
    String recommendation
) {
    public OilAnalysis {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long abnormalResultCount() {
        return results.stream().filter(OilTestResult::isAbnormal).count();
    }
}
