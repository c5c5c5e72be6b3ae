package com.pdm.engine.history;

/**
 * Source of work orders, inspections and oil analyses for an equipment item.
 * Implementations may block on I/O; the engine calls them off the request
 * thread.
 */
public interface HistoricalRecordsProvider {

    HistoricalRecords fetch(String assetId, String equipmentId);

    /**
     * Provider for deployments with no maintenance-history backend: every
     * item has no records, so the engine reasons from OEM data and live
     * readings alone.
     */
    static HistoricalRecordsProvider none() {
        return (assetId, equipmentId) -> HistoricalRecords.empty();
    }
}
