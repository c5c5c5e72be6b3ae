package com.pdm.engine.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.InspectionCondition;
import com.pdm.common.model.OilCondition;
import com.pdm.common.model.ResultStatus;
import com.pdm.common.model.Trend;
import com.pdm.common.model.WorkOrderType;
import com.pdm.common.model.history.InspectionRecord;
import com.pdm.common.model.history.OilAnalysis;
import com.pdm.common.model.history.OilTestResult;
import com.pdm.common.model.history.WorkOrder;
import com.pdm.engine.catalog.CatalogLoadException;
import com.pdm.engine.catalog.CatalogReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Generates plausible maintenance history from a hash of the asset and
 * equipment ids. Same ids, same records (dates move with the clock).
 * Used for demos and tests where no CMMS is connected.
 */
@Slf4j
public class SeededHistoricalRecordsProvider implements HistoricalRecordsProvider {

    private static final TypeReference<Map<String, WorkOrderIssues>> ISSUES_BY_TYPE = new TypeReference<>() {};

    private static final List<String> INSPECTORS = List.of(
            "Ahmed Hassan", "Mohammed Al-Rashid", "Khalid Omar", "Saeed Al-Mansoori");

    private static final List<String> FOLLOW_UP_ACTIONS = List.of(
            "Schedule maintenance within 7 days",
            "Order replacement parts",
            "Increase inspection frequency",
            "Consult OEM for guidance",
            "Coordinate with operations for downtime");

    private static final String OIL_LAB = "SGS Middle East";

    private final Map<EquipmentType, WorkOrderIssues> issuesByType;
    private final Clock clock;

    public SeededHistoricalRecordsProvider(Map<EquipmentType, WorkOrderIssues> issuesByType, Clock clock) {
        if (!issuesByType.containsKey(EquipmentType.MAIN_ENGINE)) {
            throw new CatalogLoadException("Work order issue texts must include main_engine");
        }
        this.issuesByType = new EnumMap<>(issuesByType);
        this.clock = clock;
    }

    public static SeededHistoricalRecordsProvider fromResource(Resource resource, Clock clock) {
        Map<String, WorkOrderIssues> raw = CatalogReader.read(resource, ISSUES_BY_TYPE);
        Map<EquipmentType, WorkOrderIssues> byType = new EnumMap<>(EquipmentType.class);
        raw.forEach((type, issues) -> byType.put(EquipmentType.fromValue(type), issues));
        log.info("Seeded history enabled with issue texts for {} equipment types", byType.size());
        return new SeededHistoricalRecordsProvider(byType, clock);
    }

    @Override
    public HistoricalRecords fetch(String assetId, String equipmentId) {
        Instant now = clock.instant();
        return new HistoricalRecords(
                workOrders(assetId, equipmentId, now),
                inspections(assetId, equipmentId, now),
                oilAnalyses(assetId, equipmentId, now));
    }

    List<WorkOrder> workOrders(String assetId, String equipmentId, Instant now) {
        SeededRandom random = new SeededRandom(assetId + equipmentId);
        EquipmentType type = EquipmentType.inferFromIdentifier(equipmentId);
        WorkOrderIssues issues = issuesByType.getOrDefault(type, issuesByType.get(EquipmentType.MAIN_ENGINE));
        int year = now.atZone(ZoneOffset.UTC).getYear();

        int count = random.nextInt(8) + 4;
        List<WorkOrder> orders = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            boolean preventive = random.chance(0.35);
            List<String> texts = preventive ? issues.preventive() : issues.corrective();
            Instant created = now.minus(Duration.ofDays(random.nextInt(180) + 1L));
            String id = "WO-" + year + "-" + (random.nextInt(900) + 100);
            String issue = texts.isEmpty() ? null : texts.get(random.nextInt(texts.size()));
            Instant completed = created.plus(Duration.ofHours(random.nextInt(48) + 4L));

            orders.add(WorkOrder.builder()
                    .id(id)
                    .assetId(assetId)
                    .assetName(assetId)
                    .equipmentId(equipmentId)
                    .equipmentName(equipmentId)
                    .type(preventive ? WorkOrderType.PM : WorkOrderType.CM)
                    .issue(issue)
                    .resolution(preventive ? "Completed as scheduled" : "Repair completed, equipment returned to service")
                    .dateCreated(created)
                    .dateCompleted(completed)
                    .laborHours(random.nextInt(16) + 2)
                    .partsCost(random.nextInt(5000) + 500)
                    .downtime(preventive ? random.nextInt(8) + 2 : random.nextInt(24) + 8)
                    .wasUnplanned(!preventive)
                    .build());
        }
        orders.sort(Comparator.comparing(WorkOrder::dateCreated).reversed());
        return orders;
    }

    List<InspectionRecord> inspections(String assetId, String equipmentId, Instant now) {
        SeededRandom random = new SeededRandom(assetId + equipmentId + "inspection");
        int year = now.atZone(ZoneOffset.UTC).getYear();

        int count = random.nextInt(4) + 2;
        List<InspectionRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Instant date = now.minus(Duration.ofDays(random.nextInt(90) + 14L));
            // generated inspections are never critical
            InspectionCondition condition = InspectionCondition.values()[random.nextInt(3)];

            records.add(InspectionRecord.builder()
                    .id("INS-" + year + "-" + (random.nextInt(900) + 100))
                    .assetId(assetId)
                    .equipmentId(equipmentId)
                    .date(date)
                    .inspector(INSPECTORS.get(random.nextInt(INSPECTORS.size())))
                    .findings(findings(random, condition))
                    .condition(condition)
                    .photosCount(random.nextInt(12) + 3)
                    .recommendedActions(condition == InspectionCondition.GOOD
                            ? List.of()
                            : FOLLOW_UP_ACTIONS.subList(0, random.nextInt(2) + 1))
                    .build());
        }
        records.sort(Comparator.comparing(InspectionRecord::date).reversed());
        return records;
    }

    List<OilAnalysis> oilAnalyses(String assetId, String equipmentId, Instant now) {
        SeededRandom random = new SeededRandom(assetId + equipmentId + "oil");
        int year = now.atZone(ZoneOffset.UTC).getYear();

        int count = random.nextInt(3) + 1;
        List<OilAnalysis> samples = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Instant date = now.minus(Duration.ofDays(random.nextInt(60) + 21L));
            OilCondition condition = random.chance(0.7) ? OilCondition.MARGINAL
                    : random.chance(0.9) ? OilCondition.CRITICAL
                    : OilCondition.GOOD;
            String id = "OIL-" + year + "-" + (random.nextInt(900) + 100);

            List<OilTestResult> results = List.of(
                    new OilTestResult("Viscosity @ 40°C", 95 + random.nextInt(20), "cSt",
                            warningIf(random.chance(0.8)), Trend.STABLE),
                    new OilTestResult("Iron (Fe)", random.nextInt(50) + 10, "ppm",
                            warningIf(random.chance(0.7)), random.chance(0.5) ? Trend.INCREASING : Trend.STABLE),
                    new OilTestResult("Water Content", random.nextInt(500) + 50, "ppm",
                            warningIf(random.chance(0.85)), Trend.STABLE),
                    new OilTestResult("Particle Count ISO", random.nextInt(4) + 16, "/17/14",
                            warningIf(random.chance(0.75)), random.chance(0.6) ? Trend.INCREASING : Trend.STABLE),
                    new OilTestResult("TAN", Math.round((random.nextDouble() * 2 + 0.5) * 10) / 10.0, "mgKOH/g",
                            warningIf(random.chance(0.8)), Trend.INCREASING));

            samples.add(OilAnalysis.builder()
                    .id(id)
                    .assetId(assetId)
                    .equipmentId(equipmentId)
                    .date(date)
                    .lab(OIL_LAB)
                    .results(results)
                    .overallCondition(condition)
                    .recommendation(oilRecommendation(condition))
                    .build());
        }
        samples.sort(Comparator.comparing(OilAnalysis::date).reversed());
        return samples;
    }

    private static ResultStatus warningIf(boolean warning) {
        return warning ? ResultStatus.WARNING : ResultStatus.NORMAL;
    }

    private static String oilRecommendation(OilCondition condition) {
        return switch (condition) {
            case CRITICAL -> "Immediate oil change recommended. Investigate source of contamination.";
            case MARGINAL -> "Schedule oil change within next 500 operating hours. Monitor wear metals.";
            case GOOD -> "Oil condition acceptable. Continue normal monitoring.";
        };
    }

    private static List<String> findings(SeededRandom random, InspectionCondition condition) {
        List<String> findings = new ArrayList<>();
        switch (condition) {
            case GOOD -> {
                findings.add("Equipment in good operating condition");
                findings.add("No visible defects or abnormalities");
                if (random.chance(0.5)) {
                    findings.add("Minor cosmetic wear within acceptable limits");
                }
            }
            case FAIR -> {
                findings.add("Minor wear observed on contact surfaces");
                findings.add("Lubrication adequate but due for service");
                if (random.chance(0.5)) {
                    findings.add("Small paint chips noted, no corrosion");
                }
            }
            case POOR -> {
                findings.add("Significant wear patterns detected");
                findings.add("Lubrication degraded, service overdue");
                findings.add("Early signs of fatigue noted");
                if (random.chance(0.5)) {
                    findings.add("Surface corrosion present");
                }
            }
            case CRITICAL -> {
                findings.add("Critical wear requiring immediate attention");
                findings.add("Visible defects affecting operation");
                findings.add("Potential safety concern identified");
                findings.add("Recommend equipment stand-down pending repair");
            }
        }
        return findings;
    }
}
