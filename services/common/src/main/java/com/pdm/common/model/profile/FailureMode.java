package com.pdm.common.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Catalogued failure mode with its base probability and the signals that
 * usually precede it.
 */
public record FailureMode(
    @JsonProperty("mode")
    String mode,

    @JsonProperty("probability")
    double probability,

    @JsonProperty("warningSignals")
    List<String> warningSignals,

    @JsonProperty("mtbf")
    Integer mtbf
) {
    public FailureMode {
        warningSignals = warningSignals == null ? List.of() : List.copyOf(warningSignals);
    }

    /**
     * True if any warning signal mentions one of the keywords (case-insensitive).
     */
    public boolean signalsMention(String... keywords) {
        for (String signal : warningSignals) {
            String lower = signal.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (lower.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }
}
