package com.pdm.engine.service;

import com.pdm.common.dto.analysis.DataPoint;
import com.pdm.common.dto.analysis.EnvironmentData;
import com.pdm.common.dto.analysis.EquipmentReading;
import com.pdm.common.dto.analysis.SourceContribution;
import com.pdm.common.model.SourceType;
import com.pdm.common.model.history.FleetPattern;
import com.pdm.common.model.history.InspectionRecord;
import com.pdm.common.model.history.OilAnalysis;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.common.model.profile.EquipmentSpecs;
import com.pdm.engine.history.HistoricalRecords;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Summarises what each evidence source contributed for one equipment item.
 * Inspection and oil analysis appear only when records exist.
 */
@Component
@RequiredArgsConstructor
public class SourceContributionAggregator {

    static final List<String> REFERENCE_STANDARDS = List.of("DNV-ST-0378", "ABS Guide for Lifting Appliances", "ISO 10816");

    private static final String NOT_AVAILABLE = "N/A";

    private final DataSourceRegistry dataSources;

    public List<SourceContribution> aggregate(EquipmentEvidence evidence, EnvironmentData environment) {
        List<SourceContribution> contributions = new ArrayList<>();
        contributions.add(telemetry(evidence));
        contributions.add(oemSpecs(evidence.profile()));
        contributions.add(workHistory(evidence.records()));
        contributions.add(fleet(evidence.fleetPatterns()));
        contributions.add(environment(environment));
        if (!evidence.records().inspections().isEmpty()) {
            contributions.add(inspections(evidence.records().inspections()));
        }
        if (!evidence.records().oilAnalyses().isEmpty()) {
            contributions.add(oil(evidence.records().oilAnalyses()));
        }
        contributions.add(industryStandards(evidence.profile()));
        return contributions;
    }

    private SourceContribution telemetry(EquipmentEvidence evidence) {
        EquipmentReading reading = evidence.reading();
        return contribution(SourceType.LIVE_TELEMETRY,
                "Real-time health score, vibration, and temperature readings",
                List.of(
                        DataPoint.of("Health Score", Math.round(evidence.health() * 10) / 10.0, "%"),
                        DataPoint.of("Vibration", orZero(reading.vibration()), "mm/s"),
                        DataPoint.of("Temperature", orZero(reading.temperature()), "°C"),
                        DataPoint.of("Operating Hours", reading.operatingHoursOrZero(), "h")));
    }

    private SourceContribution oemSpecs(EquipmentProfile profile) {
        EquipmentSpecs specs = profile.specs();
        return contribution(SourceType.OEM_SPECS,
                profile.manufacturer() + " " + profile.model() + " maintenance specifications and wear curve",
                List.of(
                        DataPoint.of("Max Hours", orNotAvailable(specs.maxOperatingHours())),
                        DataPoint.of("PM Interval", orNotAvailable(specs.maintenanceIntervalHours()), "h"),
                        DataPoint.of("MTBF", orNotAvailable(specs.mtbf()), "h")));
    }

    private SourceContribution workHistory(HistoricalRecords records) {
        int total = records.workOrders().size();
        int corrective = records.correctiveOrders().size();
        long preventive = records.preventiveCount();
        return contribution(SourceType.WORK_HISTORY,
                total + " historical records analyzed (" + corrective + " CM, " + preventive + " PM)",
                List.of(
                        DataPoint.of("Total Records", total),
                        DataPoint.of("Corrective", corrective),
                        DataPoint.of("Preventive", preventive)));
    }

    private SourceContribution fleet(List<FleetPattern> patterns) {
        int occurrences = patterns.stream().mapToInt(FleetPattern::occurrences).sum();
        Set<String> assets = new LinkedHashSet<>();
        patterns.forEach(pattern -> assets.addAll(pattern.affectedAssets()));
        String summary = patterns.isEmpty()
                ? "No recorded fleet failure patterns for this equipment type"
                : "Cross-referenced " + patterns.size() + " fleet failure patterns across "
                        + assets.size() + " assets";
        return contribution(SourceType.FLEET_DATA, summary,
                List.of(
                        DataPoint.of("Matching Patterns", patterns.size()),
                        DataPoint.of("Total Occurrences", occurrences),
                        DataPoint.of("Affected Assets", assets.size())));
    }

    private SourceContribution environment(EnvironmentData environment) {
        if (environment == null) {
            return contribution(SourceType.ENVIRONMENT,
                    "Operating environment factors: offshore conditions, salt exposure, load severity",
                    List.of(
                            DataPoint.of("Exposure", "High Salt"),
                            DataPoint.of("Load Factor", 68, "%")));
        }
        List<DataPoint> points = new ArrayList<>();
        if (environment.temperature() != null) {
            points.add(DataPoint.of("Ambient Temperature", environment.temperature(), "°C"));
        }
        if (environment.humidity() != null) {
            points.add(DataPoint.of("Humidity", environment.humidity(), "%"));
        }
        if (environment.seaState() != null) {
            points.add(DataPoint.of("Sea State", environment.seaState()));
        }
        if (environment.windSpeed() != null) {
            points.add(DataPoint.of("Wind Speed", environment.windSpeed(), "kn"));
        }
        return contribution(SourceType.ENVIRONMENT,
                "Reported operating conditions at time of analysis", points);
    }

    private SourceContribution inspections(List<InspectionRecord> inspections) {
        InspectionRecord latest = inspections.get(0);
        int findings = inspections.stream().mapToInt(record -> record.findings().size()).sum();
        return contribution(SourceType.INSPECTION_RECORDS,
                inspections.size() + " inspection reports reviewed, latest by " + latest.inspector(),
                List.of(
                        DataPoint.of("Records", inspections.size()),
                        DataPoint.of("Latest Condition", latest.condition().getValue()),
                        DataPoint.of("Total Findings", findings)));
    }

    private SourceContribution oil(List<OilAnalysis> samples) {
        OilAnalysis latest = samples.get(0);
        return contribution(SourceType.OIL_ANALYSIS,
                samples.size() + " oil samples analyzed by " + latest.lab(),
                List.of(
                        DataPoint.of("Samples", samples.size()),
                        DataPoint.of("Latest Condition", latest.overallCondition().getValue()),
                        DataPoint.of("Warning Results", latest.abnormalResultCount())));
    }

    private SourceContribution industryStandards(EquipmentProfile profile) {
        return contribution(SourceType.INDUSTRY_STANDARDS,
                "Failure mode probabilities and inspection practice from classification society guidance",
                List.of(
                        DataPoint.of("Failure Modes", profile.failureModes().size()),
                        DataPoint.of("Reference Standards", String.join(", ", REFERENCE_STANDARDS))));
    }

    private SourceContribution contribution(SourceType type, String summary, List<DataPoint> points) {
        return new SourceContribution(dataSources.get(type), summary, type.getRelevanceScore(), points);
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static Object orNotAvailable(Integer value) {
        return value != null ? value : NOT_AVAILABLE;
    }
}
