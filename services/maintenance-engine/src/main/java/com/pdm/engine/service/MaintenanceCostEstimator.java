package com.pdm.engine.service;

import com.pdm.common.dto.analysis.CostOfInaction;
import com.pdm.common.dto.analysis.CostRange;
import com.pdm.common.dto.analysis.DowntimeRange;
import com.pdm.common.model.Priority;
import com.pdm.common.model.UsageUnit;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.common.model.profile.MaintenanceTask;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rough cost and downtime model. The base cost is derived from the duration
 * of the profile's heaviest (last listed) maintenance task and scaled by the
 * priority's cost multiplier.
 */
@Component
public class MaintenanceCostEstimator {

    static final String CURRENCY = "USD";
    static final double COST_PER_TASK_HOUR = 500;
    static final double DEFAULT_BASE_COST = 10_000;

    public CostEstimate estimate(EquipmentProfile profile, Priority priority) {
        double base = baseCost(profile);
        double multiplier = priority.getCostMultiplier();

        CostOfInaction inaction = new CostOfInaction(
                Math.round(base * multiplier * 2),
                CURRENCY,
                "Unplanned failure could result in " + Math.round(24 * multiplier)
                        + "-" + Math.round(72 * multiplier) + " hours downtime");
        CostRange repair = new CostRange(Math.round(base * 0.8), Math.round(base * 1.5), CURRENCY);
        DowntimeRange downtime = new DowntimeRange(
                Math.round(8 * multiplier), Math.round(24 * multiplier), UsageUnit.HOURS);
        return new CostEstimate(inaction, repair, downtime);
    }

    double baseCost(EquipmentProfile profile) {
        List<MaintenanceTask> tasks = profile.maintenanceTasks();
        if (tasks.isEmpty()) {
            return DEFAULT_BASE_COST;
        }
        double base = tasks.get(tasks.size() - 1).estimatedDuration() * COST_PER_TASK_HOUR;
        return base > 0 ? base : DEFAULT_BASE_COST;
    }
}
