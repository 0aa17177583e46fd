package com.supersoft.sparkpay.csv_ingestion_worker.domain;

/**
 * Row-level rejection codes, in the order they take precedence.
 */
public enum RowReasonCode {
    MISSING_IDENTIFIER,
    INVALID_FORMAT,
    FIELD_TOO_LONG
}
