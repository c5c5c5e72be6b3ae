package com.pdm.engine.service;

import com.pdm.common.model.Priority;
import org.springframework.stereotype.Component;

/**
 * Maps health, remaining life and failure likelihood to a priority tier.
 * All thresholds are strict.
 */
@Component
public class PriorityClassifier {

    static final double HIGH_PROBABILITY = 0.5;

    public Priority classify(double health, double remainingLifePercent, boolean highProbabilityFailure) {
        if (health < 30 || remainingLifePercent < 10 || highProbabilityFailure) {
            return Priority.CRITICAL;
        }
        if (health < 50 || remainingLifePercent < 25) {
            return Priority.HIGH;
        }
        if (health < 70 || remainingLifePercent < 50) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    public boolean isHighProbability(double failureProbability) {
        return failureProbability > HIGH_PROBABILITY;
    }
}
