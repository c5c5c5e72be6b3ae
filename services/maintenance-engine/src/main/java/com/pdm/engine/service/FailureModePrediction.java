package com.pdm.engine.service;

import java.util.List;

/**
 * The failure mode judged most likely for an equipment item.
 */
public record FailureModePrediction(
    String mode,
    double probability,
    List<String> warningSignals
) {
    public FailureModePrediction {
        warningSignals = warningSignals == null ? List.of() : List.copyOf(warningSignals);
    }
}
