package com.supersoft.sparkpay.csv_ingestion_worker.exception;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;

public class SourceUnavailableException extends BatchFatalException {

    public SourceUnavailableException(String message) {
        super(BatchErrorCode.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(BatchErrorCode.SOURCE_UNAVAILABLE, message, cause);
    }
}
