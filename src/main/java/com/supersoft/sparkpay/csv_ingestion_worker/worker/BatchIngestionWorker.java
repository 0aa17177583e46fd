package com.supersoft.sparkpay.csv_ingestion_worker.worker;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.IngestionReport;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.BatchFatalException;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.LeaseLostException;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.ImportBatchRepository;
import com.supersoft.sparkpay.csv_ingestion_worker.service.BatchLease;
import com.supersoft.sparkpay.csv_ingestion_worker.service.FailureClassifier;
import com.supersoft.sparkpay.csv_ingestion_worker.service.HeartbeatReporter;
import com.supersoft.sparkpay.csv_ingestion_worker.service.IngestionPipeline;
import com.supersoft.sparkpay.csv_ingestion_worker.service.StreamFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.InputStream;

/**
 * Runs one claimed batch to a terminal state, or gives it back when the failure is worth retrying.
 */
@Slf4j
@Component
public class BatchIngestionWorker {

    @Autowired
    private HeartbeatReporter heartbeatReporter;

    @Autowired
    private StreamFetcher streamFetcher;

    @Autowired
    private IngestionPipeline pipeline;

    @Autowired
    private ImportBatchRepository batchRepository;

    @Autowired
    private FailureClassifier failureClassifier;

    @Autowired
    private WorkerIdentity workerIdentity;

    @Value("${ingestion.max-attempts:3}")
    private int maxAttempts;

    public void process(ImportBatch batch) {
        String workerId = workerIdentity.getWorkerId();
        log.info("Processing batch: batchId={}, tenantId={}, attempt={}, file={}",
                batch.getId(), batch.getTenantId(), batch.getAttemptCount(), batch.getOriginalFileName());

        BatchLease lease = heartbeatReporter.start(batch, workerId);
        try {
            if (batch.getColumnMapping() == null) {
                throw new BatchFatalException(BatchErrorCode.INTERNAL_ERROR,
                        "Batch " + batch.getId() + " has an unreadable column mapping");
            }

            IngestionReport report;
            try (InputStream source = streamFetcher.openStream(batch)) {
                report = pipeline.ingest(lease, source);
            }

            lease.ensureHeld();
            if (batchRepository.completeBatch(batch, workerId, report)) {
                log.info("Batch staged: batchId={}, totalRows={}, staged={}, errors={}, durationMs={}",
                        batch.getId(), report.getTotalRows(), report.getStagedCount(), report.getErrorCount(),
                        report.getDurationMs());
            }
        } catch (LeaseLostException e) {
            log.warn("Abandoning batch {}: {}", batch.getId(), e.getMessage());
        } catch (BatchFatalException e) {
            log.error("Batch {} failed with {}: {}", batch.getId(), e.getErrorCode(), e.getMessage(), e);
            fail(lease, e.getErrorCode());
        } catch (Exception e) {
            handleUnexpectedFailure(lease, e);
        } finally {
            lease.close();
        }
    }

    private void handleUnexpectedFailure(BatchLease lease, Exception e) {
        ImportBatch batch = lease.getBatch();
        FailureClassifier.FailureType failureType = failureClassifier.classifyFailure(e);
        log.error("Batch processing failed: batchId={}, type={}", batch.getId(), failureType, e);

        if (!failureClassifier.isRetryable(failureType)) {
            fail(lease, BatchErrorCode.INTERNAL_ERROR);
            return;
        }
        if (lease.isLost()) {
            log.warn("Not releasing batch {}: lease already lost", batch.getId());
            return;
        }
        try {
            if (batchRepository.releaseBatch(batch, lease.getWorkerId(), BatchErrorCode.TRANSIENT_FAILURE, maxAttempts)) {
                log.info("Batch {} released after {} failure (attempt {}/{})",
                        batch.getId(), failureType, batch.getAttemptCount(), maxAttempts);
            } else {
                log.warn("Batch {} could not be released - lease no longer held", batch.getId());
            }
        } catch (DataAccessException ex) {
            log.error("Could not release batch {}; the reaper will recover it", batch.getId(), ex);
        }
    }

    private void fail(BatchLease lease, BatchErrorCode errorCode) {
        if (lease.isLost()) {
            log.warn("Not failing batch {} with {}: lease already lost", lease.getBatch().getId(), errorCode);
            return;
        }
        try {
            batchRepository.failBatch(lease.getBatch(), lease.getWorkerId(), errorCode);
        } catch (DataAccessException ex) {
            log.error("Could not mark batch {} as FAILED; the reaper will recover it",
                    lease.getBatch().getId(), ex);
        }
    }
}
