package com.supersoft.sparkpay.csv_ingestion_worker.worker;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.service.BatchClaimer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * This process's run loop: claims batches while concurrency permits are free and hands each one
 * to the ingestion executor.
 */
@Slf4j
@Component
public class IngestionPollLoop {

    @Autowired
    private BatchClaimer batchClaimer;

    @Autowired
    private BatchIngestionWorker batchWorker;

    @Autowired
    private WorkerIdentity workerIdentity;

    @Autowired
    @Qualifier("ingestionExecutor")
    private TaskExecutor ingestionExecutor;

    @Value("${ingestion.poll.enabled:true}")
    private boolean pollEnabled;

    @Value("${ingestion.concurrency:2}")
    private int concurrency;

    private Semaphore permits;

    @Scheduled(fixedDelayString = "${ingestion.poll-interval-ms:5000}",
            initialDelayString = "${ingestion.poll-initial-delay-ms:1000}")
    public void scheduledPoll() {
        if (!pollEnabled) {
            return;
        }
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Error polling for uploaded batches", e);
        }
    }

    /**
     * Claims and dispatches batches until no permit is free or nothing is eligible.
     *
     * @return number of batches dispatched
     */
    public synchronized int pollOnce() {
        Semaphore available = permits();
        String workerId = workerIdentity.getWorkerId();
        int dispatched = 0;

        while (available.tryAcquire()) {
            Optional<ImportBatch> claimed;
            try {
                claimed = batchClaimer.claimNext(workerId);
            } catch (RuntimeException e) {
                available.release();
                throw e;
            }
            if (claimed.isEmpty()) {
                available.release();
                break;
            }

            ImportBatch batch = claimed.get();
            try {
                ingestionExecutor.execute(() -> {
                    try {
                        batchWorker.process(batch);
                    } finally {
                        available.release();
                    }
                });
                dispatched++;
            } catch (TaskRejectedException e) {
                available.release();
                // Claimed but never started: no heartbeat, so the reaper hands it back.
                log.error("Executor rejected batch {}; it will be reclaimed once stale", batch.getId(), e);
                break;
            }
        }

        if (dispatched > 0) {
            log.info("Worker {} dispatched {} batches ({} permits free)", workerId, dispatched,
                    available.availablePermits());
        }
        return dispatched;
    }

    public int inFlight() {
        return concurrency - permits().availablePermits();
    }

    private synchronized Semaphore permits() {
        if (permits == null) {
            permits = new Semaphore(Math.max(1, concurrency));
        }
        return permits;
    }
}
