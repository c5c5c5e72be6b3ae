package com.pdm.engine.config;

import com.pdm.engine.catalog.CatalogFleetPatternCatalog;
import com.pdm.engine.catalog.CatalogOemProfileStore;
import com.pdm.engine.catalog.FleetPatternCatalog;
import com.pdm.engine.catalog.OemProfileStore;
import com.pdm.engine.issue.KnownIssueLookup;
import com.pdm.engine.issue.StaticKnownIssueLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reference data: OEM profiles, fleet patterns and the known-issue feed.
 * Catalog files that cannot be read fail start-up.
 */
@Slf4j
@Configuration
public class CatalogConfig {

    @Bean
    public OemProfileStore oemProfileStore(@Value("${pdm.catalog.oem-profiles}") Resource profiles) {
        return CatalogOemProfileStore.fromResource(profiles);
    }

    @Bean
    public FleetPatternCatalog fleetPatternCatalog(@Value("${pdm.catalog.fleet-patterns}") Resource patterns) {
        return CatalogFleetPatternCatalog.fromResource(patterns);
    }

    @Bean
    @ConditionalOnMissingBean(KnownIssueLookup.class)
    public KnownIssueLookup knownIssueLookup(
            @Value("${pdm.issues.resource:}") String location,
            ResourceLoader resourceLoader) {
        if (location.isBlank()) {
            log.info("No known-issue feed configured; predictions rely on computed estimates only");
            return StaticKnownIssueLookup.empty();
        }
        return StaticKnownIssueLookup.fromResource(resourceLoader.getResource(location));
    }
}
