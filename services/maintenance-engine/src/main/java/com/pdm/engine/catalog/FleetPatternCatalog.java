package com.pdm.engine.catalog;

import com.pdm.common.model.EquipmentType;
import com.pdm.common.model.history.FleetPattern;

import java.util.List;

/**
 * Cross-fleet failure pattern statistics.
 */
public interface FleetPatternCatalog {

    /**
     * Patterns for one equipment type, in catalog order.
     */
    List<FleetPattern> findPatterns(EquipmentType type);

    List<FleetPattern> allPatterns();
}
