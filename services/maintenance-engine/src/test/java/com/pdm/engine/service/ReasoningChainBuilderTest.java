package com.pdm.engine.service;

import com.pdm.common.dto.analysis.EquipmentReading;
import com.pdm.common.dto.analysis.ReasoningStep;
import com.pdm.common.dto.issue.EquipmentIssue;
import com.pdm.common.dto.issue.PmPrediction;
import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.IssueStatus;
import com.pdm.common.model.Priority;
import com.pdm.common.model.SourceType;
import com.pdm.common.model.WorkOrderType;
import com.pdm.common.model.history.WorkOrder;
import com.pdm.engine.TestCatalogs;
import com.pdm.engine.history.HistoricalRecords;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ReasoningChainBuilderTest {

    private final ReasoningChainBuilder builder = new ReasoningChainBuilder();

    private final EquipmentReading hoistMotor = EquipmentReading.builder()
            .id("sep-450-hoist")
            .name("Main Hoist Motor")
            .type(EquipmentType.HOIST_MOTOR)
            .operatingHours(20000.0)
            .vibration(4.0)
            .temperature(80.0)
            .build();

    @Test
    void shouldNarrateAllAvailableEvidenceInOrder() {
        // Given
        EquipmentEvidence evidence = new EquipmentEvidence(
                hoistMotor,
                TestCatalogs.profile(EquipmentType.HOIST_MOTOR),
                80,
                new HistoricalRecords(List.of(
                        workOrder(WorkOrderType.CM, "Bearing replacement - excessive vibration", 10),
                        workOrder(WorkOrderType.PM, "Motor bearing regreasing", 20),
                        workOrder(WorkOrderType.CM, "Motor overheating investigation", 40)), null, null),
                TestCatalogs.fleetPatterns().findPatterns(EquipmentType.HOIST_MOTOR),
                Optional.of(new FailureModePrediction("Bearing failure", 0.84, List.of("Increased vibration"))),
                Optional.of(new ScheduledTask("Vibration analysis", 500, 1, List.of())),
                Optional.empty());

        // When
        List<ReasoningStep> steps = builder.build(evidence);

        // Then
        assertThat(steps).extracting(ReasoningStep::text).containsExactly(
                "Current operating hours: 20,000h with health score at 80%",
                "OEM recommends \"Vibration analysis\" in 500 operating hours",
                "2 corrective maintenance events in past 6 months - most recent: \"Bearing replacement - excessive vibration\"",
                "Fleet analysis: 6 similar hoist motors showed \"Bearing degradation under continuous heavy-lift operations\" - avg failure at 22,000 hours",
                "Vibration at 4 mm/s (89% of threshold) - elevated level indicates bearing or alignment concern",
                "Operating temperature 80°C (94% of max rated 85°C)",
                "Most probable failure mode: \"Bearing failure\" (84% probability based on current indicators)");
        assertThat(steps).extracting(ReasoningStep::id).containsExactly(
                "sep-450-hoist-step-1", "sep-450-hoist-step-2", "sep-450-hoist-step-3", "sep-450-hoist-step-4",
                "sep-450-hoist-step-5", "sep-450-hoist-step-6", "sep-450-hoist-step-7");
        assertThat(steps).extracting(ReasoningStep::sourceType).containsExactly(
                SourceType.LIVE_TELEMETRY, SourceType.OEM_SPECS, SourceType.WORK_HISTORY, SourceType.FLEET_DATA,
                SourceType.LIVE_TELEMETRY, SourceType.LIVE_TELEMETRY, SourceType.INDUSTRY_STANDARDS);
        assertThat(steps).extracting(ReasoningStep::isKey).containsExactly(
                false, false, true, true, true, false, true);
        assertThat(steps.get(6).confidence()).isEqualTo(84);
    }

    @Test
    void shouldReportCycleUsageAgainstRatedCycles() {
        EquipmentReading wireRope = EquipmentReading.builder()
                .id("rope-1")
                .name("Main Hoist Wire Rope")
                .type(EquipmentType.WIRE_ROPE)
                .cycleCount(12000L)
                .build();
        EquipmentEvidence evidence = new EquipmentEvidence(
                wireRope, TestCatalogs.profile(EquipmentType.WIRE_ROPE), 50, HistoricalRecords.empty(), List.of(),
                Optional.empty(), Optional.of(new ScheduledTask("Visual inspection", 50, 0.5, List.of())),
                Optional.empty());

        List<ReasoningStep> steps = builder.build(evidence);

        // no maintenance interval on wire ropes, so no OEM task step
        assertThat(steps).extracting(ReasoningStep::text).containsExactly(
                "Current operating hours: N/Ah with health score at 50%",
                "Cycle count at 12,000 (80.0% of OEM rated 15,000 cycles)");
    }

    @Test
    void shouldLeadWithKnownIssue() {
        EquipmentIssue issue = new EquipmentIssue("Hoist Motor", "Drive-end bearing running hot", IssueStatus.WARNING, 61.0,
                new PmPrediction("Bearing failure", Priority.HIGH, List.of("Temperature rise"), "Regrease bearings"));
        EquipmentEvidence evidence = new EquipmentEvidence(
                hoistMotor, TestCatalogs.profile(EquipmentType.HOIST_MOTOR), 61, HistoricalRecords.empty(), List.of(),
                Optional.empty(), Optional.empty(), Optional.of(issue));

        List<ReasoningStep> steps = builder.build(evidence);

        ReasoningStep first = steps.get(0);
        assertThat(first.id()).isEqualTo("sep-450-hoist-step-1");
        assertThat(first.text()).isEqualTo("Known issue detected: Drive-end bearing running hot. Status: WARNING.");
        assertThat(first.confidence()).isEqualTo(95);
        assertThat(first.isKey()).isTrue();
        assertThat(steps.get(1).text()).startsWith("Current operating hours");
    }

    @Test
    void shouldCapCorrectiveEventsAtThree() {
        List<WorkOrder> orders = List.of(
                workOrder(WorkOrderType.CM, "Emergency bearing replacement", 5),
                workOrder(WorkOrderType.CM, "Winding repair - hot spot detected", 30),
                workOrder(WorkOrderType.CM, "Shaft seal replacement - oil leakage", 60),
                workOrder(WorkOrderType.CM, "Motor overheating investigation", 90));
        EquipmentReading idle = EquipmentReading.builder()
                .id("m-2").name("Aux Motor").type(EquipmentType.HOIST_MOTOR).build();
        EquipmentEvidence evidence = new EquipmentEvidence(
                idle, TestCatalogs.profile(EquipmentType.HOIST_MOTOR), 100, new HistoricalRecords(orders, null, null),
                List.of(), Optional.empty(), Optional.empty(), Optional.empty());

        List<ReasoningStep> steps = builder.build(evidence);

        assertThat(steps).hasSize(2);
        assertThat(steps.get(1).text()).startsWith("3 corrective maintenance events");
    }

    private static WorkOrder workOrder(WorkOrderType type, String issue, int daysAgo) {
        return WorkOrder.builder()
                .id("WO-" + daysAgo)
                .type(type)
                .issue(issue)
                .dateCreated(TestCatalogs.NOW.minus(Duration.ofDays(daysAgo)))
                .build();
    }
}
