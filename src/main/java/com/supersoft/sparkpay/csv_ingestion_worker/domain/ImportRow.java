package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A staged source row. Keyed by {@code (batchId, rowNumber)} and never updated once written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportRow {
    private UUID batchId;
    private UUID tenantId;
    private int rowNumber;
    private Map<String, String> rawPayload;
    private ImportPlayerPayload normalizedPayload;
    private RowStatus status;
    private String reasonCode;
    private String reasonDetail;
    private LocalDateTime createdAt;

    public enum RowStatus {
        STAGED, ERROR
    }
}
