package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One unit of ingestion work: a single uploaded tabular file owned by a tenant.
 * Lease fields ({@code claimedBy}, {@code claimedAt}, {@code heartbeatAt}) are null while unclaimed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportBatch {
    private UUID id;
    private UUID tenantId;
    private BatchStatus status;
    private String sourcePointer;
    private String originalFileName;
    private ColumnMapping columnMapping;
    private String claimedBy;
    private LocalDateTime claimedAt;
    private LocalDateTime heartbeatAt;
    private int attemptCount;
    private int totalRows;
    private IngestionReport reportSummary;
    private String lastErrorCode;
    private LocalDateTime lastErrorAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isTerminal() {
        return status == BatchStatus.STAGED || status == BatchStatus.FAILED;
    }

    public enum BatchStatus {
        CREATED, UPLOADED, PARSING, STAGED, FAILED
    }
}
