package com.pdm.common.dto.issue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.Priority;

import java.util.List;

/**
 * Maintenance verdict attached to a reported equipment issue.
 */
public record PmPrediction(
    @JsonProperty("predictedIssue")
    String predictedIssue,

    @JsonProperty("priority")
    Priority priority,

    @JsonProperty("warningSignals")
    List<String> warningSignals,

    @JsonProperty("recommendedAction")
    String recommendedAction
) {
    public PmPrediction {
        warningSignals = warningSignals == null ? List.of() : List.copyOf(warningSignals);
    }
}
