package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import lombok.Value;

/**
 * Counts of batches affected by one reaper pass.
 */
@Value
public class ReaperResult {
    /** Batches returned to UPLOADED for another attempt. */
    int reset;
    /** Batches moved to FAILED with WORKER_LOST. */
    int failed;
}
