package com.pdm.engine.service;

import com.pdm.common.dto.analysis.Analysis;
import com.pdm.common.dto.analysis.AnalysisRequest;
import com.pdm.common.dto.analysis.DegradationPoint;
import com.pdm.common.dto.analysis.EquipmentReading;
import com.pdm.common.dto.analysis.Prediction;
import com.pdm.common.dto.analysis.ReasoningStep;
import com.pdm.common.dto.analysis.SourceContribution;
import com.pdm.common.model.Priority;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Analyses all equipment of an asset. Each item is assessed independently on
 * the analysis scheduler; results are merged in input order, predictions
 * sorted most severe first.
 */
@Service
public class MaintenanceAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceAnalysisEngine.class);

    static final long NEUTRAL_HEALTH = 100;
    static final Duration REANALYSIS_INTERVAL = Duration.ofHours(24);

    private final EquipmentAssessor assessor;
    private final DegradationCurveGenerator curveGenerator;
    private final DataSourceRegistry dataSources;
    private final Clock clock;
    private final Scheduler scheduler;
    private final int concurrency;
    private final String analysisVersion;
    private final MeterRegistry meterRegistry;

    // Metrics
    private final Counter analysesCompleted;
    private final Counter analysesFailed;
    private final Timer analysisDuration;

    public MaintenanceAnalysisEngine(
            EquipmentAssessor assessor,
            DegradationCurveGenerator curveGenerator,
            DataSourceRegistry dataSources,
            Clock clock,
            @Qualifier("analysisScheduler") Scheduler scheduler,
            @Value("${pdm.engine.concurrency:8}") int concurrency,
            @Value("${pdm.engine.analysis-version:2.1.0}") String analysisVersion,
            MeterRegistry meterRegistry) {
        this.assessor = assessor;
        this.curveGenerator = curveGenerator;
        this.dataSources = dataSources;
        this.clock = clock;
        this.scheduler = scheduler;
        this.concurrency = Math.max(1, concurrency);
        this.analysisVersion = analysisVersion;
        this.meterRegistry = meterRegistry;

        this.analysesCompleted = Counter.builder("pdm.analyses.completed")
                .description("Number of asset analyses completed")
                .register(meterRegistry);

        this.analysesFailed = Counter.builder("pdm.analyses.failed")
                .description("Number of asset analyses that failed")
                .register(meterRegistry);

        this.analysisDuration = Timer.builder("pdm.analysis.duration")
                .description("Time taken to analyse one asset")
                .register(meterRegistry);
    }

    /**
     * Blocking variant of {@link #analyzeAsync(AnalysisRequest)}.
     */
    public Analysis analyze(AnalysisRequest request) {
        return analyzeAsync(request).block();
    }

    public Mono<Analysis> analyzeAsync(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        List<EquipmentReading> equipment = request.equipmentList() != null ? request.equipmentList() : List.of();

        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            log.info("Analysing asset={} ({} equipment items)", request.assetId(), equipment.size());

            return Flux.fromIterable(equipment)
                    .flatMapSequential(reading -> Mono.fromCallable(() -> assessor.assess(request, reading))
                            .subscribeOn(scheduler), concurrency)
                    .collectList()
                    .map(assessments -> merge(request, assessments))
                    .doOnSuccess(analysis -> {
                        sample.stop(analysisDuration);
                        analysesCompleted.increment();
                        analysis.predictions().forEach(prediction -> meterRegistry
                                .counter("pdm.predictions", "priority", prediction.priority().getValue())
                                .increment());
                        log.info("Completed analysis for asset={}: overallHealth={}, predictions={}",
                                request.assetId(), analysis.overallHealthScore(), analysis.predictions().size());
                    })
                    .doOnError(error -> {
                        analysesFailed.increment();
                        log.error("Analysis failed for asset={}: {}", request.assetId(), error.getMessage());
                    });
        });
    }

    private Analysis merge(AnalysisRequest request, List<EquipmentAssessment> assessments) {
        Instant now = clock.instant();

        long overallHealth = assessments.isEmpty()
                ? NEUTRAL_HEALTH
                : Math.round(assessments.stream().mapToDouble(EquipmentAssessment::health).sum() / assessments.size());

        List<ReasoningStep> reasoning = assessments.stream()
                .flatMap(assessment -> assessment.reasoningChain().stream())
                .toList();

        // Stream.sorted is stable on ordered streams, so equal priorities keep input order
        List<Prediction> predictions = assessments.stream()
                .map(EquipmentAssessment::prediction)
                .sorted(Comparator.comparing(Prediction::priority, Priority.BY_SEVERITY))
                .toList();

        List<SourceContribution> contributions = List.of();
        List<DegradationPoint> curve = List.of();
        if (!assessments.isEmpty()) {
            EquipmentAssessment first = assessments.get(0);
            contributions = first.sourceContributions();
            curve = curveGenerator.generate(first.health(), first.reading().operatingHoursOrZero(), first.reading().type());
        }

        return Analysis.builder()
                .id(analysisId(request.assetId(), now))
                .assetType(request.assetType())
                .assetId(request.assetId())
                .assetName(request.assetName())
                .timestamp(now)
                .status(Analysis.STATUS_COMPLETE)
                .sourcesQueried(dataSources.sources())
                .sourceContributions(contributions)
                .reasoningChain(reasoning)
                .predictions(predictions)
                .degradationCurve(curve)
                .overallHealthScore(overallHealth)
                .nextAnalysisRecommended(now.plus(REANALYSIS_INTERVAL))
                .analysisVersion(analysisVersion)
                .build();
    }

    private static String analysisId(String assetId, Instant timestamp) {
        return UUID.nameUUIDFromBytes((assetId + "@" + timestamp).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
