package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.SourceType;

/**
 * One source-attributed statement in a reasoning chain. Key steps are the
 * evidence that decided the recommendation.
 */
public record ReasoningStep(
    @JsonProperty("id")
    String id,

    @JsonProperty("text")
    String text,

    @JsonProperty("sourceType")
    SourceType sourceType,

    @JsonProperty("confidence")
    int confidence,

    @JsonProperty("isKey")
    boolean isKey
) {
}
