package com.pdm.engine.service;

import com.pdm.common.dto.analysis.DegradationPoint;
import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.profile.EquipmentSpecs;
import com.pdm.engine.catalog.OemProfileStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Health-over-time chart for an asset: a linear back-fill from 100% to the
 * current health over the last ten days, then five monthly projections with
 * a pessimism factor applied to the observed wear rate.
 */
@Component
@RequiredArgsConstructor
public class DegradationCurveGenerator {

    static final int HISTORY_POINTS = 10;
    static final int PROJECTED_POINTS = 5;
    static final double DEFAULT_OPERATING_HOURS = 5000;
    static final double DEFAULT_MAX_HOURS = 20000;
    static final double PESSIMISM = 1.2;
    static final Duration PROJECTION_STEP = Duration.ofDays(30);

    private final OemProfileStore profileStore;
    private final Clock clock;

    public List<DegradationPoint> generate(double currentHealth, double operatingHours, EquipmentType type) {
        EquipmentSpecs specs = profileStore.getProfile(type).specs();
        double hours = operatingHours > 0 ? operatingHours : DEFAULT_OPERATING_HOURS;
        double maxHours = specs.maxOperatingHours() != null && specs.maxOperatingHours() > 0
                ? specs.maxOperatingHours() : DEFAULT_MAX_HOURS;
        Instant now = clock.instant();

        List<DegradationPoint> points = new ArrayList<>(HISTORY_POINTS + 1 + PROJECTED_POINTS);
        for (int i = 0; i <= HISTORY_POINTS; i++) {
            double health = 100 - (100 - currentHealth) * i / HISTORY_POINTS;
            points.add(new DegradationPoint(
                    now.minus(Duration.ofDays(HISTORY_POINTS - i)), oneDecimal(health), false));
        }

        double ratePerHour = (100 - currentHealth) / hours;
        double interval = Math.max(0, (maxHours - hours) / HISTORY_POINTS);
        for (int i = 1; i <= PROJECTED_POINTS; i++) {
            double projected = Math.max(0, currentHealth - ratePerHour * interval * i * PESSIMISM);
            points.add(new DegradationPoint(now.plus(PROJECTION_STEP.multipliedBy(i)), oneDecimal(projected), true));
        }
        return points;
    }

    private static double oneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
