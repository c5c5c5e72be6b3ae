package com.pdm.engine.service;

import com.pdm.common.dto.analysis.EquipmentReading;
import com.pdm.common.dto.analysis.Prediction;
import com.pdm.common.dto.analysis.ReasoningStep;
import com.pdm.common.dto.analysis.SourceContribution;

import java.util.List;

/**
 * Result of assessing a single equipment item, before fan-in.
 */
public record EquipmentAssessment(
    EquipmentReading reading,
    double health,
    Prediction prediction,
    List<ReasoningStep> reasoningChain,
    List<SourceContribution> sourceContributions
) {
    public EquipmentAssessment {
        reasoningChain = List.copyOf(reasoningChain);
        sourceContributions = List.copyOf(sourceContributions);
    }
}
