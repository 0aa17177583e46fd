package com.supersoft.sparkpay.csv_ingestion_worker.domain;

/**
 * Coarse codes recorded in {@code import_batch.last_error_code}.
 */
public enum BatchErrorCode {
    SOURCE_UNAVAILABLE,
    MALFORMED_SOURCE,
    ROW_LIMIT_EXCEEDED,
    CHUNK_WRITE_FAILED,
    MAX_ATTEMPTS_EXCEEDED,
    WORKER_LOST,
    TRANSIENT_FAILURE,
    INTERNAL_ERROR
}
