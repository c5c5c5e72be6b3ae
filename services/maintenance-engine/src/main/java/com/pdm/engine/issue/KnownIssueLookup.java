package com.pdm.engine.issue;

import com.pdm.common.dto.issue.EquipmentIssue;

import java.util.Optional;

/**
 * Boundary to the vessel issue feed. A reported issue is authoritative for
 * the equipment it names and replaces the engine's own estimates.
 */
public interface KnownIssueLookup {

    /**
     * Finds the reported issue for an equipment item of an asset, matching
     * equipment names on their first word.
     */
    Optional<EquipmentIssue> findIssue(String assetId, String equipmentName);
}
