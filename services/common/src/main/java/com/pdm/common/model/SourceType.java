package com.pdm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The eight evidence sources fused by the analysis engine, with the fixed
 * relevance score each one carries in a source contribution.
 */
public enum SourceType {
    LIVE_TELEMETRY("live_telemetry", 95),
    OEM_SPECS("oem_specs", 100),
    WORK_HISTORY("work_history", 88),
    FLEET_DATA("fleet_data", 82),
    ENVIRONMENT("environment", 75),
    INSPECTION_RECORDS("inspection_records", 85),
    OIL_ANALYSIS("oil_analysis", 92),
    INDUSTRY_STANDARDS("industry_standards", 70);

    private final String value;
    private final int relevanceScore;

    SourceType(String value, int relevanceScore) {
        this.value = value;
        this.relevanceScore = relevanceScore;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRelevanceScore() {
        return relevanceScore;
    }

    @JsonCreator
    public static SourceType fromValue(String value) {
        for (SourceType type : SourceType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
