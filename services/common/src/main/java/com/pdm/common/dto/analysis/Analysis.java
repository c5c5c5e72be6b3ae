package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.AssetType;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Result of analysing one asset. Predictions are sorted most severe first.
 */
@Builder
public record Analysis(
    @JsonProperty("id")
    String id,

    @JsonProperty("assetType")
    AssetType assetType,

    @JsonProperty("assetId")
    String assetId,

    @JsonProperty("assetName")
    String assetName,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("status")
    String status,

    @JsonProperty("sourcesQueried")
    List<DataSource> sourcesQueried,

    @JsonProperty("sourceContributions")
    List<SourceContribution> sourceContributions,

    @JsonProperty("reasoningChain")
    List<ReasoningStep> reasoningChain,

    @JsonProperty("predictions")
    List<Prediction> predictions,

    @JsonProperty("degradationCurve")
    List<DegradationPoint> degradationCurve,

    @JsonProperty("overallHealthScore")
    long overallHealthScore,

    @JsonProperty("nextAnalysisRecommended")
    Instant nextAnalysisRecommended,

    @JsonProperty("analysisVersion")
    String analysisVersion
) {
    public static final String STATUS_COMPLETE = "complete";

    public Analysis {
        sourcesQueried = sourcesQueried == null ? List.of() : List.copyOf(sourcesQueried);
        sourceContributions = sourceContributions == null ? List.of() : List.copyOf(sourceContributions);
        reasoningChain = reasoningChain == null ? List.of() : List.copyOf(reasoningChain);
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
        degradationCurve = degradationCurve == null ? List.of() : List.copyOf(degradationCurve);
    }
}
