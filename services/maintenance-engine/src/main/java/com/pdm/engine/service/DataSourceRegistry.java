package com.pdm.engine.service;

import com.pdm.common.dto.analysis.DataSource;
import com.pdm.common.model.SourceType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Descriptors of the evidence sources the engine queries. Freshness is
 * expressed relative to the current time.
 */
@Component
@RequiredArgsConstructor
public class DataSourceRegistry {

    private final Clock clock;

    public List<DataSource> sources() {
        Instant now = clock.instant();
        return Arrays.stream(Descriptor.values())
                .map(descriptor -> descriptor.toDataSource(now))
                .toList();
    }

    public DataSource get(SourceType type) {
        Instant now = clock.instant();
        return Arrays.stream(Descriptor.values())
                .filter(descriptor -> descriptor.type == type)
                .findFirst()
                .map(descriptor -> descriptor.toDataSource(now))
                .orElseThrow(() -> new IllegalArgumentException("Unknown source type: " + type));
    }

    private enum Descriptor {
        TELEMETRY("src-telemetry", SourceType.LIVE_TELEMETRY, "Live Sensor Telemetry",
                "Real-time data from equipment sensors", 0, 95, "Activity"),
        OEM("src-oem", SourceType.OEM_SPECS, "OEM Specifications",
                "Manufacturer maintenance intervals and wear curves", 30, 100, "FileText"),
        HISTORY("src-history", SourceType.WORK_HISTORY, "Work Order History",
                "Historical maintenance and repair records", 2, 88, "ClipboardList"),
        FLEET("src-fleet", SourceType.FLEET_DATA, "Fleet Intelligence",
                "Similar equipment patterns across the fleet", 7, 82, "Ship"),
        ENVIRONMENT("src-environment", SourceType.ENVIRONMENT, "Operating Environment",
                "Weather, sea state, and operational conditions", 0, 90, "Cloud"),
        INSPECTION("src-inspection", SourceType.INSPECTION_RECORDS, "Inspection Records",
                "Visual and NDT inspection findings", 14, 85, "Eye"),
        OIL("src-oil", SourceType.OIL_ANALYSIS, "Oil Analysis Reports",
                "Lubricant condition and wear debris analysis", 21, 92, "Droplets"),
        INDUSTRY("src-industry", SourceType.INDUSTRY_STANDARDS, "Industry Standards",
                "DNV, ABS, and industry best practices", 90, 100, "BookOpen");

        private final String id;
        private final SourceType type;
        private final String name;
        private final String description;
        private final int ageDays;
        private final int dataQuality;
        private final String iconName;

        Descriptor(String id, SourceType type, String name, String description,
                   int ageDays, int dataQuality, String iconName) {
            this.id = id;
            this.type = type;
            this.name = name;
            this.description = description;
            this.ageDays = ageDays;
            this.dataQuality = dataQuality;
            this.iconName = iconName;
        }

        DataSource toDataSource(Instant now) {
            return new DataSource(id, type, name, description,
                    now.minus(Duration.ofDays(ageDays)), dataQuality, true, iconName);
        }
    }
}
