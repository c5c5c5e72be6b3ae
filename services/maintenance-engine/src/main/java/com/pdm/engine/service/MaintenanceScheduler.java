package com.pdm.engine.service;

import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.common.model.profile.MaintenanceTask;
import com.pdm.engine.catalog.OemProfileStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Finds the OEM task that falls due soonest given current operating hours.
 */
@Component
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final OemProfileStore profileStore;

    public Optional<ScheduledTask> nextTask(EquipmentType type, double operatingHours) {
        return nextTask(profileStore.getProfile(type), operatingHours);
    }

    public Optional<ScheduledTask> nextTask(EquipmentProfile profile, double operatingHours) {
        MaintenanceTask next = null;
        double nextDueIn = Double.MAX_VALUE;
        for (MaintenanceTask task : profile.maintenanceTasks()) {
            if (task.intervalHours() <= 0) {
                continue;
            }
            double lastDone = Math.floor(operatingHours / task.intervalHours()) * task.intervalHours();
            double dueIn = lastDone + task.intervalHours() - operatingHours;
            if (dueIn > 0 && dueIn < nextDueIn) {
                next = task;
                nextDueIn = dueIn;
            }
        }

        if (next == null) {
            return Optional.empty();
        }
        return Optional.of(new ScheduledTask(next.task(), nextDueIn, next.estimatedDuration(), next.requiredParts()));
    }
}
