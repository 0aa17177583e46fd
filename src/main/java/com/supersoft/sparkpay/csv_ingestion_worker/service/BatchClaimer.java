package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.ImportBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Exclusive claim of the next uploaded batch. Concurrent claimers never receive the same batch.
 */
@Slf4j
@Service
public class BatchClaimer {

    @Autowired
    private ImportBatchRepository batchRepository;

    @Value("${ingestion.max-attempts:3}")
    private int maxAttempts;

    public Optional<ImportBatch> claimNext(String workerId) {
        Optional<ImportBatch> claimed = batchRepository.claimNext(workerId, maxAttempts);
        if (claimed.isEmpty()) {
            log.debug("No eligible batch for worker {}", workerId);
        }
        return claimed;
    }
}
