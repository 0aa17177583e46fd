package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportRow;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.RowOutcome;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.BatchFatalException;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.LeaseLostException;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.ImportRowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Persists row outcomes one chunk per transaction. Rows already present for the same
 * {@code (batch, row_number)} are skipped, so replaying a chunk after a crash is harmless.
 */
@Slf4j
@Service
public class ChunkedRowWriter {

    @Autowired
    private ImportRowRepository rowRepository;

    @Value("${ingestion.chunk-size:500}")
    private int chunkSize;

    @Value("${ingestion.chunk.max-retries:3}")
    private int maxRetries;

    @Value("${ingestion.chunk.initial-backoff-ms:200}")
    private long initialBackoffMs;

    @Value("${ingestion.chunk.backoff-multiplier:2.0}")
    private double backoffMultiplier;

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Writes one chunk under the given lease.
     *
     * @return rows actually inserted; conflicting rows are not counted
     * @throws LeaseLostException if the claim is no longer held, without retrying
     * @throws BatchFatalException with CHUNK_WRITE_FAILED once retries are exhausted
     */
    public int writeChunk(BatchLease lease, List<RowOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return 0;
        }
        if (outcomes.size() > chunkSize) {
            throw new IllegalArgumentException("Chunk of " + outcomes.size() + " rows exceeds chunk size " + chunkSize);
        }
        lease.ensureHeld();

        ImportBatch batch = lease.getBatch();
        List<ImportRow> rows = toRows(batch, outcomes);
        int attempt = 0;
        while (true) {
            try {
                int inserted = rowRepository.insertChunk(batch, lease.getWorkerId(), rows);
                log.debug("Chunk for batch {} rows {}-{}: {} inserted, {} already present",
                        batch.getId(), rows.get(0).getRowNumber(), rows.get(rows.size() - 1).getRowNumber(),
                        inserted, rows.size() - inserted);
                return inserted;
            } catch (LeaseLostException e) {
                lease.markLost();
                throw e;
            } catch (DataAccessException e) {
                attempt++;
                if (attempt > maxRetries) {
                    throw new BatchFatalException(BatchErrorCode.CHUNK_WRITE_FAILED,
                            "Chunk write for batch " + batch.getId() + " failed after " + maxRetries + " retries", e);
                }
                long delay = calculateBackoff(attempt);
                log.warn("Chunk write for batch {} failed (attempt {}/{}), retrying in {}ms: {}",
                        batch.getId(), attempt, maxRetries, delay, e.getMessage());
                sleep(batch, delay, e);
                lease.ensureHeld();
            }
        }
    }

    /**
     * Exponential backoff: delay = initial * (multiplier ^ (attempt - 1))
     */
    long calculateBackoff(int attempt) {
        if (attempt <= 1) {
            return initialBackoffMs;
        }
        return (long) (initialBackoffMs * Math.pow(backoffMultiplier, attempt - 1));
    }

    private List<ImportRow> toRows(ImportBatch batch, List<RowOutcome> outcomes) {
        List<ImportRow> rows = new ArrayList<>(outcomes.size());
        for (RowOutcome outcome : outcomes) {
            rows.add(ImportRow.builder()
                    .batchId(batch.getId())
                    .tenantId(batch.getTenantId())
                    .rowNumber(outcome.getRowNumber())
                    .rawPayload(outcome.getRow().getRawRow())
                    .normalizedPayload(outcome.isStaged() ? outcome.getRow().getPayload() : null)
                    .status(outcome.getStatus())
                    .reasonCode(outcome.getReasonCode() != null ? outcome.getReasonCode().name() : null)
                    .reasonDetail(outcome.getReasonDetail())
                    .build());
        }
        return rows;
    }

    private void sleep(ImportBatch batch, long delayMs, DataAccessException lastFailure) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            BatchFatalException fatal = new BatchFatalException(BatchErrorCode.CHUNK_WRITE_FAILED,
                    "Interrupted while retrying chunk write for batch " + batch.getId(), lastFailure);
            fatal.addSuppressed(e);
            throw fatal;
        }
    }
}
