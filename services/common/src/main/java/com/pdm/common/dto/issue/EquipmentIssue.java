package com.pdm.common.dto.issue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.IssueStatus;

import java.util.Locale;

/**
 * Authoritative status for one equipment item, supplied by the known-issue
 * feed. When present it overrides the engine's own health, failure mode and
 * priority for that item.
 */
public record EquipmentIssue(
    @JsonProperty("equipmentName")
    String equipmentName,

    @JsonProperty("issue")
    String issue,

    @JsonProperty("status")
    IssueStatus status,

    @JsonProperty("healthScore")
    Double healthScore,

    @JsonProperty("pmPrediction")
    PmPrediction pmPrediction
) {
    /**
     * Matches on the first word of either name appearing, case-insensitively,
     * inside the other name.
     */
    public boolean matches(String candidateName) {
        if (candidateName == null || equipmentName == null) {
            return false;
        }
        String candidate = candidateName.toLowerCase(Locale.ROOT);
        String own = equipmentName.toLowerCase(Locale.ROOT);
        return candidate.contains(firstWord(own)) || own.contains(firstWord(candidate));
    }

    /**
     * Failure probability implied by the reported status.
     */
    public double impliedProbability() {
        if (status == IssueStatus.CRITICAL) {
            return 0.85;
        }
        if (status == IssueStatus.WARNING) {
            return 0.65;
        }
        return 0.45;
    }

    private static String firstWord(String name) {
        String trimmed = name.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
