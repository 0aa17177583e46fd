package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.LeaseLostException;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One worker's hold on a claimed batch for the duration of a run. Shared between the pipeline
 * thread and the heartbeat thread.
 */
public class BatchLease implements AutoCloseable {

    private final ImportBatch batch;
    private final String workerId;
    private final AtomicBoolean lost = new AtomicBoolean(false);
    private final AtomicInteger rowsProcessed = new AtomicInteger(0);
    private volatile ScheduledFuture<?> heartbeat;

    public BatchLease(ImportBatch batch, String workerId) {
        this.batch = batch;
        this.workerId = workerId;
    }

    public ImportBatch getBatch() {
        return batch;
    }

    public String getWorkerId() {
        return workerId;
    }

    public boolean isLost() {
        return lost.get();
    }

    public void markLost() {
        lost.set(true);
    }

    /**
     * @throws LeaseLostException once a heartbeat or a write found the claim gone
     */
    public void ensureHeld() {
        if (lost.get()) {
            throw new LeaseLostException(batch.getId(), workerId);
        }
    }

    public void recordProgress(int rows) {
        rowsProcessed.set(rows);
    }

    public int getRowsProcessed() {
        return rowsProcessed.get();
    }

    void attachHeartbeat(ScheduledFuture<?> heartbeat) {
        this.heartbeat = heartbeat;
    }

    /**
     * Stops the heartbeat. Safe to call more than once.
     */
    @Override
    public void close() {
        ScheduledFuture<?> task = heartbeat;
        if (task != null) {
            task.cancel(false);
        }
    }
}
