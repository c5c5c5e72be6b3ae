package com.pdm.common.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.SourceType;

import java.time.Instant;

/**
 * Descriptor of an evidence source queried during analysis.
 */
public record DataSource(
    @JsonProperty("id")
    String id,

    @JsonProperty("type")
    SourceType type,

    @JsonProperty("name")
    String name,

    @JsonProperty("description")
    String description,

    @JsonProperty("lastUpdated")
    Instant lastUpdated,

    @JsonProperty("dataQuality")
    int dataQuality,

    @JsonProperty("isAvailable")
    boolean isAvailable,

    @JsonProperty("iconName")
    String iconName
) {
}
