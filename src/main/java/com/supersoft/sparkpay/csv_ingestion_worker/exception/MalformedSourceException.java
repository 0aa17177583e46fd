package com.supersoft.sparkpay.csv_ingestion_worker.exception;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;

public class MalformedSourceException extends BatchFatalException {

    public MalformedSourceException(String message, Throwable cause) {
        super(BatchErrorCode.MALFORMED_SOURCE, message, cause);
    }
}
