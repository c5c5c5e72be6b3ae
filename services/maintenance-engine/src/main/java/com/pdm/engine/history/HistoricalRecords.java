package com.pdm.engine.history;

import com.pdm.common.model.history.InspectionRecord;
import com.pdm.common.model.history.OilAnalysis;
import com.pdm.common.model.history.WorkOrder;

import java.util.List;

/**
 * Maintenance history of one equipment item, each list newest first.
 */
public record HistoricalRecords(
    List<WorkOrder> workOrders,
    List<InspectionRecord> inspections,
    List<OilAnalysis> oilAnalyses
) {
    public HistoricalRecords {
        workOrders = workOrders == null ? List.of() : List.copyOf(workOrders);
        inspections = inspections == null ? List.of() : List.copyOf(inspections);
        oilAnalyses = oilAnalyses == null ? List.of() : List.copyOf(oilAnalyses);
    }

    public static HistoricalRecords empty() {
        return new HistoricalRecords(List.of(), List.of(), List.of());
    }

    public List<WorkOrder> correctiveOrders() {
        return workOrders.stream().filter(WorkOrder::isCorrective).toList();
    }

    public long preventiveCount() {
        return workOrders.stream().filter(WorkOrder::isPreventive).count();
    }
}
