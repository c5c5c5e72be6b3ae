package com.pdm.engine.service;

import com.pdm.common.dto.analysis.EquipmentReading;
import com.pdm.common.dto.issue.EquipmentIssue;
import com.pdm.common.model.history.FleetPattern;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.engine.history.HistoricalRecords;

import java.util.List;
import java.util.Optional;

/**
 * Everything gathered about one equipment item before a recommendation is
 * made. Health is the resolved value, after any known-issue override.
 */
public record EquipmentEvidence(
    EquipmentReading reading,
    EquipmentProfile profile,
    double health,
    HistoricalRecords records,
    List<FleetPattern> fleetPatterns,
    Optional<FailureModePrediction> failureMode,
    Optional<ScheduledTask> nextTask,
    Optional<EquipmentIssue> knownIssue
) {
    public EquipmentEvidence {
        records = records == null ? HistoricalRecords.empty() : records;
        fleetPatterns = fleetPatterns == null ? List.of() : List.copyOf(fleetPatterns);
        failureMode = failureMode == null ? Optional.empty() : failureMode;
        nextTask = nextTask == null ? Optional.empty() : nextTask;
        knownIssue = knownIssue == null ? Optional.empty() : knownIssue;
    }
}
