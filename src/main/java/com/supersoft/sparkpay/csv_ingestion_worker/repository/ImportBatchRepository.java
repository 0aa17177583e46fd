package com.supersoft.sparkpay.csv_ingestion_worker.repository;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.IngestionReport;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ReaperResult;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle writes on {@code import_batch}. Every write that follows a claim is scoped by the
 * batch id, the tenant id and attempt count recorded on the claimed batch, and the owning worker id;
 * a {@code false} return means the caller no longer holds the lease.
 */
public interface ImportBatchRepository {

    /**
     * Fails UPLOADED batches that already used {@code maxAttempts} claims, then atomically claims the
     * oldest remaining UPLOADED batch for {@code workerId}, skipping rows locked by concurrent claimers.
     */
    Optional<ImportBatch> claimNext(String workerId, int maxAttempts);

    boolean heartbeat(ImportBatch batch, String workerId, int rowsProcessed);

    boolean completeBatch(ImportBatch batch, String workerId, IngestionReport report);

    boolean failBatch(ImportBatch batch, String workerId, BatchErrorCode errorCode);

    /**
     * Gives a claimed batch back after a transient failure: UPLOADED while attempts remain,
     * otherwise FAILED with MAX_ATTEMPTS_EXCEEDED.
     */
    boolean releaseBatch(ImportBatch batch, String workerId, BatchErrorCode errorCode, int maxAttempts);

    ReaperResult reapStale(Duration staleThreshold, int maxAttempts);

    Optional<ImportBatch> findById(UUID tenantId, UUID batchId);
}
