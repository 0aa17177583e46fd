package com.supersoft.sparkpay.csv_ingestion_worker.repository;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportRow;

import java.util.List;
import java.util.UUID;

public interface ImportRowRepository {

    /**
     * Inserts a chunk with "do nothing on conflict" semantics on {@code (batch_id, row_number)}.
     * Batch and tenant ids are taken from {@code batch}, never from the rows.
     *
     * @return number of rows actually inserted; replayed rows count as zero
     * @throws com.supersoft.sparkpay.csv_ingestion_worker.exception.LeaseLostException if
     *         {@code workerId} no longer owns the batch
     */
    int insertChunk(ImportBatch batch, String workerId, List<ImportRow> rows);

    List<ImportRow> findByBatch(UUID tenantId, UUID batchId, ImportRow.RowStatus status, int page, int size);

    long countByBatch(UUID tenantId, UUID batchId, ImportRow.RowStatus status);
}
