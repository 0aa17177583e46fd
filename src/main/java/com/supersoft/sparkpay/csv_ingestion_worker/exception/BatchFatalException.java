package com.supersoft.sparkpay.csv_ingestion_worker.exception;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;

/**
 * Halts consumption of a batch's source and moves the batch to FAILED with {@link #getErrorCode()}.
 */
public class BatchFatalException extends RuntimeException {

    private final BatchErrorCode errorCode;

    public BatchFatalException(BatchErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BatchFatalException(BatchErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public BatchErrorCode getErrorCode() {
        return errorCode;
    }
}
