package com.pdm.engine.issue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pdm.common.dto.issue.EquipmentIssue;
import com.pdm.engine.catalog.CatalogReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Known issues keyed by asset id, loaded from a JSON resource. Within an
 * asset the first matching entry wins.
 */
@Slf4j
public class StaticKnownIssueLookup implements KnownIssueLookup {

    private static final TypeReference<Map<String, List<EquipmentIssue>>> ISSUES_BY_ASSET = new TypeReference<>() {};

    private final Map<String, List<EquipmentIssue>> issuesByAsset;

    public StaticKnownIssueLookup(Map<String, List<EquipmentIssue>> issuesByAsset) {
        Map<String, List<EquipmentIssue>> normalized = new HashMap<>();
        issuesByAsset.forEach((assetId, issues) ->
                normalized.put(assetId.toLowerCase(Locale.ROOT), List.copyOf(issues)));
        this.issuesByAsset = Map.copyOf(normalized);
    }

    public static StaticKnownIssueLookup empty() {
        return new StaticKnownIssueLookup(Map.of());
    }

    public static StaticKnownIssueLookup fromResource(Resource resource) {
        Map<String, List<EquipmentIssue>> loaded = CatalogReader.read(resource, ISSUES_BY_ASSET);
        log.info("Loaded known issues for {} assets from {}", loaded.size(), resource.getDescription());
        return new StaticKnownIssueLookup(loaded);
    }

    @Override
    public Optional<EquipmentIssue> findIssue(String assetId, String equipmentName) {
        if (assetId == null) {
            return Optional.empty();
        }
        return issuesByAsset.getOrDefault(assetId.toLowerCase(Locale.ROOT), List.of()).stream()
                .filter(issue -> issue.matches(equipmentName))
                .findFirst();
    }
}
