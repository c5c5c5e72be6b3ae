package com.pdm.engine.controller;

import com.pdm.common.dto.analysis.Analysis;
import com.pdm.common.dto.analysis.AnalysisRequest;
import com.pdm.engine.service.MaintenanceAnalysisEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * REST controller for running predictive maintenance analyses.
 *
 * Endpoints:
 * - POST /api/v1/analyses - Analyse the equipment of one asset
 * - GET  /api/v1/analyses/health - Connectivity check
 */
@RestController
@RequestMapping("/api/v1/analyses")
@Tag(name = "Analyses", description = "Predictive maintenance analysis")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final MaintenanceAnalysisEngine engine;
    private final Duration timeout;

    public AnalysisController(
            MaintenanceAnalysisEngine engine,
            @Value("${pdm.engine.timeout:10s}") Duration timeout) {
        this.engine = engine;
        this.timeout = timeout;
    }

    @PostMapping(
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Analyse an asset", description = "Returns prioritised predictions with their reasoning")
    public Mono<ResponseEntity<Analysis>> analyze(@Valid @RequestBody AnalysisRequest request) {
        log.debug("Received analysis request: asset={}, equipment={}",
                request.assetId(), request.equipmentList().size());

        return engine.analyzeAsync(request)
                .timeout(timeout)
                .map(ResponseEntity::ok);
    }

    /**
     * Health check endpoint for simple connectivity test.
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
