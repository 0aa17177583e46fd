package com.supersoft.sparkpay.csv_ingestion_worker.exception;

import java.util.UUID;

/**
 * Thrown when this worker no longer owns the claim on a batch, e.g. after the reaper reassigned it.
 * The stale run must stop without writing anything further.
 */
public class LeaseLostException extends RuntimeException {

    private final UUID batchId;

    public LeaseLostException(UUID batchId, String workerId) {
        super("Lease on batch " + batchId + " is no longer held by worker " + workerId);
        this.batchId = batchId;
    }

    public UUID getBatchId() {
        return batchId;
    }
}
