package com.pdm.engine.service;

import com.pdm.common.dto.analysis.EquipmentReading;
import com.pdm.common.dto.analysis.ReasoningStep;
import com.pdm.common.dto.issue.EquipmentIssue;
import com.pdm.common.model.SourceType;
import com.pdm.common.model.history.FleetPattern;
import com.pdm.common.model.history.WorkOrder;
import com.pdm.common.model.profile.EquipmentSpecs;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the human-readable, source-attributed explanation behind a
 * prediction. Steps only appear when their evidence exists.
 */
@Component
public class ReasoningChainBuilder {

    static final int DEFAULT_EXPECTED_CYCLES = 15_000;
    static final double DEFAULT_MAX_VIBRATION = 5;
    static final double DEFAULT_MAX_TEMPERATURE = 80;
    static final int RECENT_CORRECTIVE_LIMIT = 3;

    public List<ReasoningStep> build(EquipmentEvidence evidence) {
        EquipmentReading reading = evidence.reading();
        EquipmentSpecs specs = evidence.profile().specs();
        List<Draft> drafts = new ArrayList<>();

        evidence.knownIssue().ifPresent(issue -> drafts.add(new Draft(
                "Known issue detected: " + issue.issue() + ". Status: " + statusLabel(issue) + ".",
                SourceType.LIVE_TELEMETRY, 95, true)));

        String hours = reading.operatingHours() != null ? NumberFormats.grouped(reading.operatingHours()) : "N/A";
        drafts.add(new Draft(
                "Current operating hours: " + hours + "h with health score at "
                        + NumberFormats.plain(evidence.health()) + "%",
                SourceType.LIVE_TELEMETRY, 95, false));

        if (reading.hasCycleCount()) {
            int expected = specs.expectedLifeCycles() != null && specs.expectedLifeCycles() > 0
                    ? specs.expectedLifeCycles() : DEFAULT_EXPECTED_CYCLES;
            String usage = String.format(Locale.US, "%.1f", reading.cycleCount() * 100.0 / expected);
            drafts.add(new Draft(
                    "Cycle count at " + NumberFormats.grouped(reading.cycleCount()) + " (" + usage
                            + "% of OEM rated " + NumberFormats.grouped(expected) + " cycles)",
                    SourceType.OEM_SPECS, 100, false));
        }

        if (specs.maintenanceIntervalHours() != null && reading.hasOperatingHours()) {
            evidence.nextTask().ifPresent(task -> drafts.add(new Draft(
                    "OEM recommends \"" + task.task() + "\" in " + NumberFormats.grouped(task.dueInHours())
                            + " operating hours",
                    SourceType.OEM_SPECS, 100, false)));
        }

        List<WorkOrder> corrective = evidence.records().correctiveOrders();
        if (!corrective.isEmpty()) {
            List<WorkOrder> recent = corrective.subList(0, Math.min(RECENT_CORRECTIVE_LIMIT, corrective.size()));
            drafts.add(new Draft(
                    recent.size() + " corrective maintenance events in past 6 months - most recent: \""
                            + recent.get(0).issue() + "\"",
                    SourceType.WORK_HISTORY, 88, recent.size() >= 2));
        }

        evidence.fleetPatterns().stream()
                .filter(pattern -> pattern.equipmentType() == reading.type())
                .findFirst()
                .ifPresent(pattern -> drafts.add(fleetStep(pattern, reading)));

        if (reading.hasVibration()) {
            drafts.add(vibrationStep(reading.vibration(), specs.maxVibration()));
        }

        if (reading.hasTemperature()) {
            double max = specs.maxTemperature() != null && specs.maxTemperature() > 0
                    ? specs.maxTemperature() : DEFAULT_MAX_TEMPERATURE;
            drafts.add(new Draft(
                    "Operating temperature " + NumberFormats.plain(reading.temperature()) + "°C ("
                            + NumberFormats.percent(reading.temperature() / max) + "% of max rated "
                            + NumberFormats.plain(max) + "°C)",
                    SourceType.LIVE_TELEMETRY, 92, false));
        }

        evidence.failureMode().ifPresent(mode -> drafts.add(new Draft(
                "Most probable failure mode: \"" + mode.mode() + "\" (" + NumberFormats.percent(mode.probability())
                        + "% probability based on current indicators)",
                SourceType.INDUSTRY_STANDARDS, (int) Math.round(mode.probability() * 100), true)));

        List<ReasoningStep> steps = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            Draft draft = drafts.get(i);
            steps.add(new ReasoningStep(
                    reading.id() + "-step-" + (i + 1), draft.text(), draft.source(), draft.confidence(), draft.key()));
        }
        return steps;
    }

    private static Draft fleetStep(FleetPattern pattern, EquipmentReading reading) {
        return new Draft(
                "Fleet analysis: " + pattern.occurrences() + " similar " + reading.type().displayName()
                        + "s showed \"" + pattern.pattern() + "\" - avg failure at "
                        + NumberFormats.grouped(pattern.averageFailurePoint().value()) + " "
                        + pattern.averageFailurePoint().unit().getValue(),
                SourceType.FLEET_DATA, 82, true);
    }

    private static Draft vibrationStep(double vibration, Double maxVibration) {
        double max = maxVibration != null && maxVibration > 0 ? maxVibration : DEFAULT_MAX_VIBRATION;
        double ratio = vibration / max;
        String status = ratio > 0.8 ? "elevated" : ratio > 0.6 ? "moderate" : "normal";
        String meaning = ratio > 0.8 ? "bearing or alignment concern" : "acceptable wear pattern";
        return new Draft(
                "Vibration at " + NumberFormats.plain(vibration) + " mm/s (" + NumberFormats.percent(ratio)
                        + "% of threshold) - " + status + " level indicates " + meaning,
                SourceType.LIVE_TELEMETRY, 90, ratio > 0.8);
    }

    private static String statusLabel(EquipmentIssue issue) {
        return issue.status() != null ? issue.status().getValue().toUpperCase(Locale.ROOT) : "UNKNOWN";
    }

    private record Draft(String text, SourceType source, int confidence, boolean key) {
    }
}
