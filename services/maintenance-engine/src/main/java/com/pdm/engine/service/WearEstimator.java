package com.pdm.engine.service;

import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.common.model.profile.WearPoint;
import com.pdm.engine.catalog.OemProfileStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Estimates health from accumulated usage by linear interpolation over the
 * OEM wear curve. Usage outside the curve is clamped to its end points.
 */
@Component
@RequiredArgsConstructor
public class WearEstimator {

    static final double NO_WEAR_MODEL_HEALTH = 100.0;

    private final OemProfileStore profileStore;

    public double estimateHealth(EquipmentType type, double usage) {
        return estimateHealth(profileStore.getProfile(type), usage);
    }

    public double estimateHealth(EquipmentProfile profile, double usage) {
        List<WearPoint> curve = profile.wearCurve();
        if (curve.isEmpty()) {
            return NO_WEAR_MODEL_HEALTH;
        }

        WearPoint first = curve.get(0);
        if (usage <= first.cycles()) {
            return first.healthPercent();
        }
        WearPoint last = curve.get(curve.size() - 1);
        if (usage >= last.cycles()) {
            return last.healthPercent();
        }

        for (int i = 0; i < curve.size() - 1; i++) {
            WearPoint lower = curve.get(i);
            WearPoint upper = curve.get(i + 1);
            if (usage < upper.cycles()) {
                double ratio = (usage - lower.cycles()) / (upper.cycles() - lower.cycles());
                return lower.healthPercent() - ratio * (lower.healthPercent() - upper.healthPercent());
            }
        }
        return last.healthPercent();
    }
}
