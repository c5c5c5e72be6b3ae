package com.pdm.engine.service;

import com.pdm.common.dto.analysis.DataSource;
import com.pdm.common.model.SourceType;
import com.pdm.engine.TestCatalogs;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DataSourceRegistryTest {

    private final DataSourceRegistry registry = new DataSourceRegistry(TestCatalogs.fixedClock());

    @Test
    void shouldDescribeEverySourceType() {
        List<DataSource> sources = registry.sources();

        assertThat(sources).extracting(DataSource::type).containsExactly(SourceType.values());
        assertThat(sources).allMatch(DataSource::isAvailable);
    }

    @Test
    void shouldExpressFreshnessRelativeToNow() {
        assertThat(registry.get(SourceType.LIVE_TELEMETRY).lastUpdated()).isEqualTo(TestCatalogs.NOW);
        assertThat(registry.get(SourceType.OEM_SPECS).lastUpdated())
                .isEqualTo(TestCatalogs.NOW.minus(Duration.ofDays(30)));
        assertThat(registry.get(SourceType.INDUSTRY_STANDARDS).lastUpdated())
                .isEqualTo(TestCatalogs.NOW.minus(Duration.ofDays(90)));
    }

    @Test
    void shouldCarryDataQuality() {
        assertThat(registry.get(SourceType.WORK_HISTORY).dataQuality()).isEqualTo(88);
        assertThat(registry.get(SourceType.OIL_ANALYSIS).id()).isEqualTo("src-oil");
    }
}
