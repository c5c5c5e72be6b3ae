package com.pdm.engine.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.history.FleetPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.util.List;

@Slf4j
public class CatalogFleetPatternCatalog implements FleetPatternCatalog {

    private static final TypeReference<List<FleetPattern>> PATTERN_LIST = new TypeReference<>() {};

    private final List<FleetPattern> patterns;

    public CatalogFleetPatternCatalog(List<FleetPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static CatalogFleetPatternCatalog fromResource(Resource resource) {
        List<FleetPattern> loaded = CatalogReader.read(resource, PATTERN_LIST);
        log.info("Loaded {} fleet patterns from {}", loaded.size(), resource.getDescription());
        return new CatalogFleetPatternCatalog(loaded);
    }

    @Override
    public List<FleetPattern> findPatterns(EquipmentType type) {
        return patterns.stream()
                .filter(pattern -> pattern.equipmentType() == type)
                .toList();
    }

    @Override
    public List<FleetPattern> allPatterns() {
        return patterns;
    }
}
