package com.pdm.engine.controller;

import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.history.FleetPattern;
import com.pdm.common.model.profile.EquipmentProfile;
import com.pdm.engine.catalog.FleetPatternCatalog;
import com.pdm.engine.catalog.OemProfileStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only access to the OEM and fleet reference catalogs.
 */
@RestController
@RequestMapping("/api/v1/catalog")
@RequiredArgsConstructor
@Tag(name = "Catalog", description = "OEM profiles and fleet failure patterns")
public class CatalogController {

    private final OemProfileStore profileStore;
    private final FleetPatternCatalog fleetPatterns;

    @GetMapping("/profiles/{type}")
    @Operation(summary = "Get the OEM profile for an equipment type")
    public Mono<ResponseEntity<EquipmentProfile>> getProfile(@PathVariable String type) {
        return Mono.fromCallable(() -> profileStore.getProfile(EquipmentType.fromValue(type)))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/fleet-patterns")
    @Operation(summary = "List fleet failure patterns, optionally for one equipment type")
    public Mono<ResponseEntity<List<FleetPattern>>> getFleetPatterns(
            @RequestParam(required = false) String type) {
        return Mono.fromCallable(() -> type == null
                        ? fleetPatterns.allPatterns()
                        : fleetPatterns.findPatterns(EquipmentType.fromValue(type)))
                .map(ResponseEntity::ok);
    }
}
