package com.pdm.engine.service;

import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.common.model.profile.EquipmentSpecs;
import com.pdm.common.model.profile.FailureMode;
import com.pdm.engine.catalog.OemProfileStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the most likely catalogued failure mode, boosting modes whose
 * warning signals match elevated vibration or temperature readings.
 */
@Component
@RequiredArgsConstructor
public class FailureModePredictor {

    static final double ELEVATED_RATIO = 0.8;
    static final double VIBRATION_BOOST = 1.5;
    static final double TEMPERATURE_BOOST = 1.4;
    static final double MAX_PROBABILITY = 0.95;

    private final OemProfileStore profileStore;

    public Optional<FailureModePrediction> predict(EquipmentType type, Double vibration, Double temperature) {
        return predict(profileStore.getProfile(type), vibration, temperature);
    }

    public Optional<FailureModePrediction> predict(EquipmentProfile profile, Double vibration, Double temperature) {
        EquipmentSpecs specs = profile.specs();
        boolean vibrationElevated = exceeds(vibration, specs.maxVibration());
        boolean temperatureElevated = exceeds(temperature, specs.maxTemperature());

        FailureMode best = null;
        double bestProbability = 0;
        for (FailureMode mode : profile.failureModes()) {
            double adjusted = mode.probability();
            if (vibrationElevated && mode.signalsMention("vibration")) {
                adjusted *= VIBRATION_BOOST;
            }
            if (temperatureElevated && mode.signalsMention("temperature", "heat")) {
                adjusted *= TEMPERATURE_BOOST;
            }
            // strict comparison keeps catalog order on ties
            if (adjusted > bestProbability) {
                best = mode;
                bestProbability = adjusted;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new FailureModePrediction(
                best.mode(), Math.min(MAX_PROBABILITY, bestProbability), best.warningSignals()));
    }

    private static boolean exceeds(Double reading, Double max) {
        return reading != null && reading > 0 && max != null && max > 0 && reading / max > ELEVATED_RATIO;
    }
}
