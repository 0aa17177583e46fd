package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.ImportBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps a claim alive on a fixed interval, independent of how fast rows are processed, and
 * reports progress through {@code total_rows}.
 */
@Slf4j
@Service
public class HeartbeatReporter {

    @Autowired
    private ImportBatchRepository batchRepository;

    @Autowired
    @Qualifier("ingestionTaskScheduler")
    private TaskScheduler taskScheduler;

    @Value("${ingestion.heartbeat-interval-ms:10000}")
    private long heartbeatIntervalMs;

    public BatchLease start(ImportBatch batch, String workerId) {
        BatchLease lease = new BatchLease(batch, workerId);
        Duration interval = Duration.ofMillis(heartbeatIntervalMs);
        ScheduledFuture<?> task = taskScheduler.scheduleAtFixedRate(
                () -> beat(lease), Instant.now().plus(interval), interval);
        lease.attachHeartbeat(task);
        log.debug("Heartbeat started for batch {} every {}ms", batch.getId(), heartbeatIntervalMs);
        return lease;
    }

    /**
     * One heartbeat. Zero rows updated means the claim was taken away; a failed round trip is only
     * logged because staleness is judged by the reaper.
     */
    void beat(BatchLease lease) {
        if (lease.isLost()) {
            return;
        }
        ImportBatch batch = lease.getBatch();
        try {
            boolean held = batchRepository.heartbeat(batch, lease.getWorkerId(), lease.getRowsProcessed());
            if (!held) {
                log.warn("Lease on batch {} lost by worker {}", batch.getId(), lease.getWorkerId());
                lease.markLost();
                lease.close();
            } else {
                log.debug("Heartbeat for batch {} at {} rows", batch.getId(), lease.getRowsProcessed());
            }
        } catch (DataAccessException e) {
            log.warn("Heartbeat for batch {} failed, will retry next interval: {}", batch.getId(), e.getMessage());
        }
    }
}
