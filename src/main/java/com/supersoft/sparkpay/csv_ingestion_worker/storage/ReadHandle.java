package com.supersoft.sparkpay.csv_ingestion_worker.storage;

import lombok.Value;

import java.time.Instant;

/**
 * Short-lived capability to read one stored object.
 */
@Value
public class ReadHandle {
    String sourcePointer;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
