package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ReaperResult;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.ImportBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Recovers batches whose worker stopped heartbeating: back to UPLOADED while attempts remain,
 * otherwise FAILED with WORKER_LOST. Safe to run on every replica at once.
 */
@Slf4j
@Service
public class BatchReaper {

    @Autowired
    private ImportBatchRepository batchRepository;

    @Value("${ingestion.reaper.enabled:true}")
    private boolean reaperEnabled;

    @Value("${ingestion.reaper.stale-threshold-ms:300000}")
    private long staleThresholdMs;

    @Value("${ingestion.max-attempts:3}")
    private int maxAttempts;

    @Scheduled(fixedDelayString = "${ingestion.reaper.interval-ms:60000}",
            initialDelayString = "${ingestion.reaper.initial-delay-ms:30000}")
    public void scheduledReap() {
        if (!reaperEnabled) {
            log.debug("Reaper is disabled");
            return;
        }
        try {
            reap();
        } catch (Exception e) {
            log.error("Error in scheduled reaper run", e);
        }
    }

    public ReaperResult reap() {
        ReaperResult result = batchRepository.reapStale(Duration.ofMillis(staleThresholdMs), maxAttempts);
        if (result.getReset() > 0 || result.getFailed() > 0) {
            log.warn("Reaper reset {} and failed {} stale batches (threshold {}ms)",
                    result.getReset(), result.getFailed(), staleThresholdMs);
        }
        return result;
    }
}
