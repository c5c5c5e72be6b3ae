package com.pdm.engine.service;

import com.pdm.common.dto.analysis.RemainingLife;
import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.UsageUnit;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.common.model.profile.EquipmentSpecs;
import com.pdm.engine.catalog.OemProfileStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Remaining useful life, by the first rule that applies:
 * <ol>
 *   <li>cycle-rated equipment with a known cycle count: cycles left of the rated life;</li>
 *   <li>equipment with rated operating hours: hours left, scaled by health,
 *       reported in days beyond one week;</li>
 *   <li>otherwise a nominal 1000 h life scaled by health, in days.</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class RemainingLifeCalculator {

    static final double HOURS_PER_WEEK = 168;
    static final double NOMINAL_LIFE_HOURS = 1000;

    private final OemProfileStore profileStore;

    public RemainingLife remainingLife(EquipmentType type, double health, double operatingHours, Long cycleCount) {
        return remainingLife(profileStore.getProfile(type), health, operatingHours, cycleCount);
    }

    public RemainingLife remainingLife(EquipmentProfile profile, double health, double operatingHours, Long cycleCount) {
        EquipmentSpecs specs = profile.specs();

        Integer expectedCycles = specs.expectedLifeCycles();
        if (cycleCount != null && expectedCycles != null && expectedCycles > 0) {
            long remaining = Math.max(0, expectedCycles - cycleCount);
            double percent = remaining * 100.0 / expectedCycles;
            return RemainingLife.of(remaining, UsageUnit.CYCLES, Math.round(percent));
        }

        Integer maxHours = specs.maxOperatingHours();
        if (maxHours != null && maxHours > 0) {
            double remainingHours = Math.max(0, maxHours - operatingHours) * (health / 100);
            double percent = remainingHours / maxHours * 100;
            if (remainingHours > HOURS_PER_WEEK) {
                return RemainingLife.of(Math.round(remainingHours / 24), UsageUnit.DAYS, Math.round(percent));
            }
            return RemainingLife.of(Math.round(remainingHours), UsageUnit.HOURS, Math.round(percent));
        }

        double days = health / 100 * NOMINAL_LIFE_HOURS / 24;
        return RemainingLife.of(Math.round(days), UsageUnit.DAYS, health);
    }
}
