package com.pdm.common.model.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pdm.common.model.WorkOrderType;
import lombok.Builder;

import java.time.Instant;

/**
 * Historical maintenance work order for one equipment item.
 */
@Builder
public record WorkOrder(
    @JsonProperty("id")
    String id,

    @JsonProperty("assetId")
    String assetId,

    @JsonProperty("assetName")
    String assetName,

    @JsonProperty("equipmentId")
    String equipmentId,

    @JsonProperty("equipmentName")
    String equipmentName,

    @JsonProperty("type")
    WorkOrderType type,

    @JsonProperty("issue")
    String issue,

    @JsonProperty("resolution")
    String resolution,

    @JsonProperty("dateCreated")
    Instant dateCreated,

    @JsonProperty("dateCompleted")
    Instant dateCompleted,

    @JsonProperty("laborHours")
    int laborHours,

    @JsonProperty("partsCost")
    int partsCost,      // USD

    @JsonProperty("downtime")
    int downtime,       // h

    @JsonProperty("wasUnplanned")
    boolean wasUnplanned
) {
    public boolean isCorrective() {
        return type == WorkOrderType.CM;
    }

    public boolean isPreventive() {
        return type == WorkOrderType.PM;
    }
}
