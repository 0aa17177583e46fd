package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ColumnMapping;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.InMemoryImportBatchRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BatchClaimerConcurrencyTest {

    private InMemoryImportBatchRepository batchRepository;
    private BatchClaimer claimer;

    @BeforeEach
    void setUp() {
        batchRepository = new InMemoryImportBatchRepository();
        claimer = new BatchClaimer();
        ReflectionTestUtils.setField(claimer, "batchRepository", batchRepository);
        ReflectionTestUtils.setField(claimer, "maxAttempts", 3);
    }

    @Test
    void testMoreClaimersThanBatches() throws Exception {
        uploadBatches(5);

        List<Optional<ImportBatch>> results = claimConcurrently(8);

        assertEquals(5, distinctClaims(results).size());
        assertEquals(3, results.stream().filter(Optional::isEmpty).count());
    }

    @Test
    void testFewerClaimersThanBatches() throws Exception {
        uploadBatches(5);

        List<Optional<ImportBatch>> results = claimConcurrently(3);

        assertEquals(3, distinctClaims(results).size());
    }

    @Test
    void testClaimsOldestFirstAndRecordsLease() {
        List<ImportBatch> uploaded = uploadBatches(2);

        ImportBatch claimed = claimer.claimNext("worker-1").orElseThrow();

        assertEquals(uploaded.get(0).getId(), claimed.getId());
        assertEquals(ImportBatch.BatchStatus.PARSING, claimed.getStatus());
        assertEquals("worker-1", claimed.getClaimedBy());
        assertNotNull(claimed.getHeartbeatAt());
        assertEquals(1, claimed.getAttemptCount());
    }

    @Test
    void testEmptyWhenNothingEligible() {
        assertTrue(claimer.claimNext("worker-1").isEmpty());
    }

    private List<ImportBatch> uploadBatches(int count) {
        List<ImportBatch> batches = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            batches.add(batchRepository.addUploaded(UUID.randomUUID(), "b" + i + ".csv", "b" + i + ".csv",
                    ColumnMapping.empty()));
        }
        return batches;
    }

    private List<Optional<ImportBatch>> claimConcurrently(int claimers) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(claimers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<ImportBatch>>> futures = new ArrayList<>();
            for (int i = 0; i < claimers; i++) {
                String workerId = "worker-" + i;
                Callable<Optional<ImportBatch>> claim = () -> {
                    start.await();
                    return claimer.claimNext(workerId);
                };
                futures.add(executor.submit(claim));
            }
            start.countDown();

            List<Optional<ImportBatch>> results = new ArrayList<>();
            for (Future<Optional<ImportBatch>> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static Set<UUID> distinctClaims(List<Optional<ImportBatch>> results) {
        Set<UUID> ids = new HashSet<>();
        for (Optional<ImportBatch> result : results) {
            result.ifPresent(batch -> assertTrue(ids.add(batch.getId()), "batch claimed twice: " + batch.getId()));
        }
        return ids;
    }
}
