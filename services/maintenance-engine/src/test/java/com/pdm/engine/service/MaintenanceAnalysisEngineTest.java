package com.pdm.engine.service;

import com.pdm.common.dto.analysis.Analysis;
import com.pdm.common.dto.analysis.AnalysisRequest;
import com.pdm.common.dto.analysis.EquipmentReading;
import com.pdm.common.dto.analysis.Prediction;
import com.pdm.common.dto.issue.EquipmentIssue;
import com.pdm.common.dto.issue.PmPrediction;
import com.pdm.common.model.AssetType;
import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.IssueStatus;
import com.pdm.common.model.Priority;
import com.pdm.common.model.UsageUnit;
import com.pdm.engine.TestCatalogs;
import com.pdm.engine.catalog.CatalogOemProfileStore;
import com.pdm.engine.catalog.OemProfileStore;
import com.pdm.engine.catalog.UnknownEquipmentProfileException;
import com.pdm.engine.history.HistoricalRecords;
import com.pdm.engine.history.HistoricalRecordsProvider;
import com.pdm.engine.issue.KnownIssueLookup;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaintenanceAnalysisEngineTest {

    private static final KnownIssueLookup NO_KNOWN_ISSUES = (assetId, equipmentName) -> Optional.empty();
    private static final HistoricalRecordsProvider NO_HISTORY = (assetId, equipmentId) -> HistoricalRecords.empty();

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    @Test
    void shouldReturnNeutralAnalysisForEmptyEquipmentList() {
        // Given
        MaintenanceAnalysisEngine engine = engine(NO_KNOWN_ISSUES);

        // When
        Analysis analysis = engine.analyze(request(List.of()));

        // Then
        assertThat(analysis.overallHealthScore()).isEqualTo(100);
        assertThat(analysis.predictions()).isEmpty();
        assertThat(analysis.degradationCurve()).isEmpty();
        assertThat(analysis.reasoningChain()).isEmpty();
        assertThat(analysis.sourceContributions()).isEmpty();
        assertThat(analysis.sourcesQueried()).hasSize(8);
        assertThat(analysis.status()).isEqualTo(Analysis.STATUS_COMPLETE);
    }

    @Test
    void shouldEstimateWireRopeHealthFromCycles() {
        EquipmentReading rope = EquipmentReading.builder()
                .id("sep-450-rope")
                .name("Main Hoist Wire Rope")
                .type(EquipmentType.WIRE_ROPE)
                .cycleCount(12000L)
                .build();

        Analysis analysis = engine(NO_KNOWN_ISSUES).analyze(request(List.of(rope)));

        Prediction prediction = analysis.predictions().get(0);
        assertThat(prediction.healthScore()).isEqualTo(50.0);
        assertThat(prediction.priority()).isEqualTo(Priority.HIGH);
        assertThat(prediction.title()).isEqualTo("Main Hoist Wire Rope - Maintenance Due Soon");
        assertThat(prediction.remainingLife().value()).isEqualTo(3000);
        assertThat(prediction.remainingLife().unit()).isEqualTo(UsageUnit.CYCLES);
        assertThat(prediction.remainingLife().percentRemaining()).isEqualTo(20.0);
        assertThat(prediction.predictedIssue()).isEqualTo("Wire breakage due to fatigue");
        assertThat(analysis.overallHealthScore()).isEqualTo(50);
    }

    @Test
    void shouldPreferKnownIssueOverWearEstimate() {
        // 8000 cycles would estimate 75% from the wear curve
        EquipmentReading rope = EquipmentReading.builder()
                .id("rope-1")
                .name("Main Hoist Wire Rope")
                .type(EquipmentType.WIRE_ROPE)
                .cycleCount(8000L)
                .currentHealth(90.0)
                .build();
        EquipmentIssue issue = new EquipmentIssue("Main Hoist Wire Rope", "Broken wires at drum end",
                IssueStatus.CRITICAL, 20.0,
                new PmPrediction("Wire breakage", Priority.CRITICAL,
                        List.of("Visible broken wires", "Diameter reduction"), "Replace wire rope before next lift"));

        Analysis analysis = engine((assetId, name) -> Optional.of(issue)).analyze(request(List.of(rope)));

        Prediction prediction = analysis.predictions().get(0);
        assertThat(prediction.healthScore()).isEqualTo(20.0);
        assertThat(prediction.priority()).isEqualTo(Priority.CRITICAL);
        assertThat(prediction.predictedIssue()).isEqualTo("Wire breakage");
        assertThat(prediction.confidence()).isEqualTo(92);
        assertThat(prediction.recommendedAction()).isEqualTo("Replace wire rope before next lift");
        assertThat(prediction.description()).isEqualTo(
                "Primary concern: Wire breakage. Warning signs include: Visible broken wires, Diameter reduction.");
        assertThat(analysis.reasoningChain().get(0).text())
                .isEqualTo("Known issue detected: Broken wires at drum end. Status: CRITICAL.");
        assertThat(analysis.overallHealthScore()).isEqualTo(20);
    }

    @Test
    void shouldSortPredictionsStablyBySeverity() {
        // Given
        Map<String, Priority> reported = Map.of(
                "Alpha Engine", Priority.LOW,
                "Bravo Engine", Priority.CRITICAL,
                "Charlie Engine", Priority.MEDIUM,
                "Delta Engine", Priority.CRITICAL);
        KnownIssueLookup lookup = (assetId, name) -> Optional.ofNullable(reported.get(name))
                .map(priority -> new EquipmentIssue(name, "Reported condition", IssueStatus.MONITORING, 60.0,
                        new PmPrediction("Reported condition", priority, List.of(), "Follow up")));

        List<EquipmentReading> engines = List.of(
                engineReading("a", "Alpha Engine"),
                engineReading("b", "Bravo Engine"),
                engineReading("c", "Charlie Engine"),
                engineReading("d", "Delta Engine"));

        // When
        Analysis analysis = engine(lookup).analyze(request(engines));

        // Then
        assertThat(analysis.predictions()).extracting(Prediction::priority)
                .containsExactly(Priority.CRITICAL, Priority.CRITICAL, Priority.MEDIUM, Priority.LOW);
        assertThat(analysis.predictions()).extracting(Prediction::equipmentId)
                .containsExactly("b", "d", "c", "a");
    }

    @Test
    void shouldMergeReasoningInInputOrderAndUseFirstItemForCurve() {
        List<EquipmentReading> items = List.of(
                engineReading("first", "Port Main Engine"),
                engineReading("second", "Starboard Main Engine"));

        Analysis analysis = engine(NO_KNOWN_ISSUES).analyze(request(items));

        assertThat(analysis.reasoningChain().get(0).id()).isEqualTo("first-step-1");
        assertThat(analysis.reasoningChain().get(analysis.reasoningChain().size() - 1).id()).startsWith("second-step-");
        assertThat(analysis.degradationCurve()).hasSize(16);
        assertThat(analysis.sourceContributions()).isNotEmpty();
        assertThat(analysis.predictions()).hasSize(2);
    }

    @Test
    void shouldFallBackToHeuristicsWhenLookupFails() {
        KnownIssueLookup failing = (assetId, name) -> {
            throw new IllegalStateException("issue feed unavailable");
        };

        Analysis analysis = engine(failing).analyze(request(List.of(engineReading("e1", "Main Engine"))));

        Prediction prediction = analysis.predictions().get(0);
        assertThat(prediction.confidence()).isBetween(85, 95);
        assertThat(prediction.predictedIssue()).isEqualTo("Injector degradation");
        assertThat(analysis.reasoningChain().get(0).text()).startsWith("Current operating hours");
    }

    @Test
    void shouldKeepAssetAndEquipmentIdsApartWhenDerivingConfidence() {
        // Given
        MaintenanceAnalysisEngine engine = engine(NO_KNOWN_ISSUES);
        AnalysisRequest first = AnalysisRequest.builder()
                .assetType(AssetType.VESSEL).assetId("ab").assetName("AB")
                .equipmentList(List.of(engineReading("c", "Main Engine")))
                .build();
        AnalysisRequest second = AnalysisRequest.builder()
                .assetType(AssetType.VESSEL).assetId("a").assetName("A")
                .equipmentList(List.of(engineReading("bc", "Main Engine")))
                .build();

        // When
        int firstConfidence = engine.analyze(first).predictions().get(0).confidence();
        int secondConfidence = engine.analyze(second).predictions().get(0).confidence();

        // Then
        assertThat(firstConfidence).isEqualTo(85 + Math.floorMod("ab:c".hashCode(), 11));
        assertThat(secondConfidence).isEqualTo(85 + Math.floorMod("a:bc".hashCode(), 11));
        assertThat(firstConfidence).isNotEqualTo(secondConfidence);
    }

    @Test
    void shouldUseRawHealthWithoutUsageData() {
        EquipmentReading boom = EquipmentReading.builder()
                .id("boom-1")
                .name("Crane Boom")
                .type(EquipmentType.CRANE_BOOM)
                .currentHealth(64.0)
                .build();

        Analysis analysis = engine(NO_KNOWN_ISSUES).analyze(request(List.of(boom)));

        assertThat(analysis.predictions().get(0).healthScore()).isEqualTo(64.0);
    }

    @Test
    void shouldDeriveFieldsDeterministically() {
        EquipmentReading generator = EquipmentReading.builder()
                .id("gen-2")
                .name("Aux Generator")
                .type(EquipmentType.GENERATOR)
                .operatingHours(12000.0)
                .build();
        MaintenanceAnalysisEngine engine = engine(NO_KNOWN_ISSUES);

        Prediction first = engine.analyze(request(List.of(generator))).predictions().get(0);
        Prediction second = engine.analyze(request(List.of(generator))).predictions().get(0);

        assertThat(second).isEqualTo(first);
        assertThat(first.alternativeActions()).containsExactly(
                "Increase monitoring frequency",
                "Order spare parts preemptively",
                "Coordinate with operations for maintenance window");
        assertThat(first.optimalMaintenanceWindow().start()).isEqualTo(TestCatalogs.NOW.plus(Duration.ofDays(7)));
        assertThat(first.optimalMaintenanceWindow().end()).isEqualTo(TestCatalogs.NOW.plus(Duration.ofDays(14)));
        assertThat(first.recommendedAction()).startsWith("Schedule \"Routine inspection\" within 250 operating hours.");
    }

    @Test
    void shouldStampAnalysisMetadata() {
        Analysis analysis = engine(NO_KNOWN_ISSUES).analyze(request(List.of(engineReading("e1", "Main Engine"))));

        assertThat(analysis.timestamp()).isEqualTo(TestCatalogs.NOW);
        assertThat(analysis.nextAnalysisRecommended()).isEqualTo(TestCatalogs.NOW.plus(Duration.ofHours(24)));
        assertThat(analysis.analysisVersion()).isEqualTo("2.1.0");
        assertThat(analysis.assetType()).isEqualTo(AssetType.VESSEL);
        assertThat(analysis.id()).isNotBlank();
    }

    @Test
    void shouldFailLoudlyForEquipmentWithoutProfile() {
        OemProfileStore ropeOnly = new CatalogOemProfileStore(List.of(TestCatalogs.profile(EquipmentType.WIRE_ROPE)));
        MaintenanceAnalysisEngine engine = engine(ropeOnly, NO_KNOWN_ISSUES);

        assertThatThrownBy(() -> engine.analyze(request(List.of(engineReading("e1", "Main Engine")))))
                .isInstanceOf(UnknownEquipmentProfileException.class)
                .hasMessageContaining("main_engine");
        assertThat(meterRegistry.get("pdm.analyses.failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordMetrics() {
        engine(NO_KNOWN_ISSUES).analyze(request(List.of(engineReading("e1", "Main Engine"))));

        assertThat(meterRegistry.get("pdm.analyses.completed").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("pdm.analysis.duration").timer().count()).isEqualTo(1);
        assertThat(meterRegistry.find("pdm.predictions").counters()).hasSize(1);
    }

    @Test
    void shouldEmitAnalysisAsynchronously() {
        MaintenanceAnalysisEngine engine = engine(NO_KNOWN_ISSUES);

        StepVerifier.create(engine.analyzeAsync(request(List.of(engineReading("e1", "Main Engine")))))
                .assertNext(analysis -> assertThat(analysis.predictions()).hasSize(1))
                .verifyComplete();
    }

    private MaintenanceAnalysisEngine engine(KnownIssueLookup lookup) {
        return engine(TestCatalogs.oemProfiles(), lookup);
    }

    private MaintenanceAnalysisEngine engine(OemProfileStore profiles, KnownIssueLookup lookup) {
        Clock clock = TestCatalogs.fixedClock();
        DataSourceRegistry dataSources = new DataSourceRegistry(clock);
        EquipmentAssessor assessor = new EquipmentAssessor(
                profiles,
                NO_HISTORY,
                TestCatalogs.fleetPatterns(),
                lookup,
                new WearEstimator(profiles),
                new FailureModePredictor(profiles),
                new RemainingLifeCalculator(profiles),
                new PriorityClassifier(),
                new MaintenanceScheduler(profiles),
                new MaintenanceCostEstimator(),
                new ReasoningChainBuilder(),
                new SourceContributionAggregator(dataSources),
                clock);
        return new MaintenanceAnalysisEngine(
                assessor,
                new DegradationCurveGenerator(profiles, clock),
                dataSources,
                clock,
                Schedulers.boundedElastic(),
                4,
                "2.1.0",
                meterRegistry);
    }

    private static EquipmentReading engineReading(String id, String name) {
        return EquipmentReading.builder()
                .id(id)
                .name(name)
                .type(EquipmentType.MAIN_ENGINE)
                .operatingHours(6200.0)
                .build();
    }

    private static AnalysisRequest request(List<EquipmentReading> equipment) {
        return AnalysisRequest.builder()
                .assetType(AssetType.VESSEL)
                .assetId("al-mirfa")
                .assetName("Al Mirfa")
                .equipmentList(equipment)
                .build();
    }
}
