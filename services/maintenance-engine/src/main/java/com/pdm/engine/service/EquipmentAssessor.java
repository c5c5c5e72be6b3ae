package com.pdm.engine.service;

import com.pdm.common.dto.analysis.AnalysisRequest;
import com.pdm.common.dto.analysis.EquipmentReading;
import com.pdm.common.dto.analysis.MaintenanceWindow;
import com.pdm.common.dto.analysis.Prediction;
import com.pdm.common.dto.analysis.ReasoningStep;
import com.pdm.common.dto.analysis.RemainingLife;
import com.pdm.common.dto.analysis.SourceContribution;
import com.pdm.common.dto.issue.EquipmentIssue;
import com.pdm.common.dto.issue.PmPrediction;
import com.pdm.common.model.Priority;
import com.pdm.common.model.history.FleetPattern;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.engine.catalog.FleetPatternCatalog;
import com.pdm.engine.catalog.OemProfileStore;
import com.pdm.engine.history.HistoricalRecords;
import com.pdm.engine.history.HistoricalRecordsProvider;
import com.pdm.engine.issue.KnownIssueLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the full evidence pipeline for one equipment item and turns it into
 * a {@link Prediction}. A known issue, when reported, takes precedence over
 * the computed health, failure mode and priority.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EquipmentAssessor {

    static final double NEUTRAL_HEALTH = 100.0;
    static final int OVERRIDE_CONFIDENCE = 92;
    static final int BASE_CONFIDENCE = 85;
    static final String GENERAL_WEAR = "General wear progression";
    static final List<String> ALTERNATIVE_ACTIONS = List.of(
            "Increase monitoring frequency",
            "Order spare parts preemptively",
            "Coordinate with operations for maintenance window");

    private final OemProfileStore profileStore;
    private final HistoricalRecordsProvider historyProvider;
    private final FleetPatternCatalog fleetPatterns;
    private final KnownIssueLookup knownIssues;
    private final WearEstimator wearEstimator;
    private final FailureModePredictor failureModePredictor;
    private final RemainingLifeCalculator remainingLifeCalculator;
    private final PriorityClassifier priorityClassifier;
    private final MaintenanceScheduler maintenanceScheduler;
    private final MaintenanceCostEstimator costEstimator;
    private final ReasoningChainBuilder reasoningChainBuilder;
    private final SourceContributionAggregator contributionAggregator;
    private final Clock clock;

    public EquipmentAssessment assess(AnalysisRequest request, EquipmentReading reading) {
        EquipmentProfile profile = profileStore.getProfile(reading.type());
        HistoricalRecords records = historyProvider.fetch(request.assetId(), reading.id());
        List<FleetPattern> patterns = fleetPatterns.findPatterns(reading.type());
        Optional<EquipmentIssue> knownIssue = lookupKnownIssue(request.assetId(), reading.name());

        double health = resolveHealth(reading, profile, knownIssue);
        Optional<FailureModePrediction> failureMode = knownIssue
                .map(EquipmentAssessor::overrideFailureMode)
                .or(() -> failureModePredictor.predict(profile, reading.vibration(), reading.temperature()));
        RemainingLife remainingLife = remainingLifeCalculator.remainingLife(
                profile, health, reading.operatingHoursOrZero(), reading.cycleCount());
        Priority priority = resolvePriority(knownIssue, health, remainingLife, failureMode);
        Optional<ScheduledTask> nextTask = maintenanceScheduler.nextTask(profile, reading.operatingHoursOrZero());

        EquipmentEvidence evidence = new EquipmentEvidence(
                reading, profile, health, records, patterns, failureMode, nextTask, knownIssue);
        List<ReasoningStep> reasoning = reasoningChainBuilder.build(evidence);
        List<SourceContribution> contributions = contributionAggregator.aggregate(evidence, request.environmentData());
        CostEstimate cost = costEstimator.estimate(profile, priority);
        Instant now = clock.instant();

        log.debug("Assessed asset={}, equipment={}: health={}, priority={}, knownIssue={}",
                request.assetId(), reading.id(), health, priority.getValue(), knownIssue.isPresent());

        Prediction prediction = Prediction.builder()
                .id(predictionId(request.assetId(), reading.id()))
                .equipmentId(reading.id())
                .equipmentName(reading.name())
                .equipmentType(reading.type())
                .assetType(request.assetType())
                .assetId(request.assetId())
                .assetName(request.assetName())
                .priority(priority)
                .title(reading.name() + " - " + priority.getHeadline())
                .description(describe(knownIssue, failureMode))
                .predictedIssue(knownIssue.map(EquipmentIssue::pmPrediction).map(PmPrediction::predictedIssue)
                        .or(() -> failureMode.map(FailureModePrediction::mode))
                        .orElse(GENERAL_WEAR))
                .healthScore(health)
                .remainingLife(remainingLife)
                .confidence(knownIssue.isPresent() ? OVERRIDE_CONFIDENCE : heuristicConfidence(request.assetId(), reading.id()))
                .recommendedAction(recommendAction(knownIssue, nextTask, remainingLife))
                .alternativeActions(ALTERNATIVE_ACTIONS)
                .costOfInaction(cost.costOfInaction())
                .estimatedRepairCost(cost.repairCost())
                .estimatedDowntime(cost.downtime())
                .partsRequired(nextTask.map(ScheduledTask::requiredParts).orElse(List.of()))
                .optimalMaintenanceWindow(new MaintenanceWindow(now.plus(Duration.ofDays(7)), now.plus(Duration.ofDays(14))))
                .build();

        return new EquipmentAssessment(reading, health, prediction, reasoning, contributions);
    }

    private Optional<EquipmentIssue> lookupKnownIssue(String assetId, String equipmentName) {
        try {
            return knownIssues.findIssue(assetId, equipmentName);
        } catch (RuntimeException e) {
            log.warn("Known-issue lookup failed for asset={}, equipment={}; using computed estimates: {}",
                    assetId, equipmentName, e.getMessage());
            return Optional.empty();
        }
    }

    double resolveHealth(EquipmentReading reading, EquipmentProfile profile, Optional<EquipmentIssue> knownIssue) {
        Optional<Double> reported = knownIssue.map(EquipmentIssue::healthScore);
        if (reported.isPresent()) {
            return clamp(reported.get());
        }
        Double usage = reading.cycleCount() != null ? Double.valueOf(reading.cycleCount()) : reading.operatingHours();
        if (usage != null && profile.hasWearCurve()) {
            return wearEstimator.estimateHealth(profile, usage);
        }
        if (reading.currentHealth() != null) {
            return clamp(reading.currentHealth());
        }
        return NEUTRAL_HEALTH;
    }

    private Priority resolvePriority(Optional<EquipmentIssue> knownIssue, double health,
                                     RemainingLife remainingLife, Optional<FailureModePrediction> failureMode) {
        Optional<Priority> reported = knownIssue.map(EquipmentIssue::pmPrediction).map(PmPrediction::priority);
        if (reported.isPresent()) {
            return reported.get();
        }
        boolean highProbability = failureMode
                .map(mode -> priorityClassifier.isHighProbability(mode.probability()))
                .orElse(false);
        return priorityClassifier.classify(health, remainingLife.percentRemaining(), highProbability);
    }

    private static FailureModePrediction overrideFailureMode(EquipmentIssue issue) {
        PmPrediction pm = issue.pmPrediction();
        String mode = pm != null && pm.predictedIssue() != null ? pm.predictedIssue() : issue.issue();
        List<String> signals = pm != null ? pm.warningSignals() : List.of();
        return new FailureModePrediction(mode, issue.impliedProbability(), signals);
    }

    private static String describe(Optional<EquipmentIssue> knownIssue, Optional<FailureModePrediction> failureMode) {
        if (knownIssue.isPresent()) {
            EquipmentIssue issue = knownIssue.get();
            PmPrediction pm = issue.pmPrediction();
            String concern = pm != null && pm.predictedIssue() != null ? pm.predictedIssue() : issue.issue();
            List<String> signals = pm != null ? pm.warningSignals() : List.of();
            return "Primary concern: " + concern + ". Warning signs include: " + String.join(", ", signals) + ".";
        }
        if (failureMode.isPresent()) {
            FailureModePrediction mode = failureMode.get();
            List<String> signals = mode.warningSignals().subList(0, Math.min(2, mode.warningSignals().size()));
            return "Primary concern: " + mode.mode() + ". Warning signs include: " + String.join(", ", signals) + ".";
        }
        return "Equipment operating within parameters but approaching maintenance threshold.";
    }

    private static String recommendAction(Optional<EquipmentIssue> knownIssue, Optional<ScheduledTask> nextTask,
                                          RemainingLife remainingLife) {
        Optional<String> reported = knownIssue.map(EquipmentIssue::pmPrediction).map(PmPrediction::recommendedAction);
        if (reported.isPresent()) {
            return reported.get();
        }
        if (nextTask.isPresent()) {
            ScheduledTask task = nextTask.get();
            return ("Schedule \"" + task.task() + "\" within " + Math.round(task.dueInHours())
                    + " operating hours. Parts required: " + String.join(", ", task.requiredParts())).trim();
        }
        return "Continue monitoring. Next inspection recommended in "
                + Math.round(remainingLife.value() * 0.3) + " " + remainingLife.unit().getValue() + ".";
    }

    private static int heuristicConfidence(String assetId, String equipmentId) {
        return BASE_CONFIDENCE + Math.floorMod((assetId + ":" + equipmentId).hashCode(), 11);
    }

    private static String predictionId(String assetId, String equipmentId) {
        return UUID.nameUUIDFromBytes((assetId + ":" + equipmentId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static double clamp(double health) {
        return Math.max(0, Math.min(100, health));
    }
}
