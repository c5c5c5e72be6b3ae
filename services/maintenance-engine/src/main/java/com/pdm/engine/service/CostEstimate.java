package com.pdm.engine.service;

import com.pdm.common.dto.analysis.CostOfInaction;
import com.pdm.common.dto.analysis.CostRange;
import com.pdm.common.dto.analysis.DowntimeRange;

public record CostEstimate(
    CostOfInaction costOfInaction,
    CostRange repairCost,
    DowntimeRange downtime
) {
}
