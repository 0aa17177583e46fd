package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ColumnMapping;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportRow;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.IngestionReport;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ReaperResult;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.BatchFatalException;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.LeaseLostException;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.InMemoryImportBatchRepository;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.InMemoryImportRowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class IngestionPipelineTest {

    private static final String PLAYERS = "E-mail,Name\n"
            + "a@x.com,Ann\n"
            + "b@x.com,Bob\n"
            + "c@x.com,Cid\n"
            + "d@x.com,Dee\n";

    private InMemoryImportBatchRepository batchRepository;
    private InMemoryImportRowRepository rowRepository;
    private ChunkedRowWriter rowWriter;
    private IngestionPipeline pipeline;

    private final UUID tenantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        batchRepository = new InMemoryImportBatchRepository();
        rowRepository = new InMemoryImportRowRepository(batchRepository);

        rowWriter = new ChunkedRowWriter();
        ReflectionTestUtils.setField(rowWriter, "rowRepository", rowRepository);
        ReflectionTestUtils.setField(rowWriter, "chunkSize", 2);
        ReflectionTestUtils.setField(rowWriter, "maxRetries", 2);
        ReflectionTestUtils.setField(rowWriter, "initialBackoffMs", 1L);
        ReflectionTestUtils.setField(rowWriter, "backoffMultiplier", 2.0);

        pipeline = new IngestionPipeline();
        ReflectionTestUtils.setField(pipeline, "rowNormalizer", new RowNormalizer());
        ReflectionTestUtils.setField(pipeline, "rowValidator", new RowValidator());
        ReflectionTestUtils.setField(pipeline, "rowWriter", rowWriter);
        ReflectionTestUtils.setField(pipeline, "rowCap", 5);
        ReflectionTestUtils.setField(pipeline, "delimiter", ',');
    }

    @Test
    void testEmailHeaderScenario() throws IOException {
        BatchLease lease = claim("worker-1");

        IngestionReport report = pipeline.ingest(lease, source("E-mail,Name\na@x.com,Ann\n,Bob\n"));

        assertEquals(2, report.getTotalRows());
        assertEquals(1, report.getStagedCount());
        assertEquals(1, report.getErrorCount());
        assertNotNull(report.getStartedAt());
        assertNotNull(report.getCompletedAt());

        List<ImportRow> rows = rowRepository.rowsFor(lease.getBatch().getId());
        assertEquals(2, rows.size());
        assertEquals(ImportRow.RowStatus.STAGED, rows.get(0).getStatus());
        assertEquals("a@x.com", rows.get(0).getNormalizedPayload().getIdentifiers().getEmail());
        assertEquals(tenantId, rows.get(0).getTenantId());
        assertEquals(ImportRow.RowStatus.ERROR, rows.get(1).getStatus());
        assertEquals("MISSING_IDENTIFIER", rows.get(1).getReasonCode());
        assertEquals(2, lease.getRowsProcessed());
    }

    @Test
    void testHeaderOnlySourceHasNoRows() throws IOException {
        BatchLease lease = claim("worker-1");

        IngestionReport report = pipeline.ingest(lease, source("E-mail,Name\n"));

        assertEquals(0, report.getTotalRows());
        assertTrue(rowRepository.rowsFor(lease.getBatch().getId()).isEmpty());
    }

    @Test
    void testExactlyRowCapIsStaged() throws IOException {
        BatchLease lease = claim("worker-1");

        IngestionReport report = pipeline.ingest(lease, source(PLAYERS + "e@x.com,Eve\n"));

        assertEquals(5, report.getTotalRows());
        assertEquals(5, rowRepository.rowsFor(lease.getBatch().getId()).size());
    }

    @Test
    void testRowCapPlusOneFailsWithoutWritingPartialChunk() {
        BatchLease lease = claim("worker-1");

        BatchFatalException e = assertThrows(BatchFatalException.class,
                () -> pipeline.ingest(lease, source(PLAYERS + "e@x.com,Eve\nf@x.com,Fay\n")));

        assertEquals(BatchErrorCode.ROW_LIMIT_EXCEEDED, e.getErrorCode());
        List<ImportRow> rows = rowRepository.rowsFor(lease.getBatch().getId());
        assertEquals(4, rows.size());
        assertTrue(rows.stream().allMatch(r -> r.getRowNumber() <= 5));
    }

    @Test
    void testReplayingSameSourceIsIdempotent() throws IOException {
        BatchLease lease = claim("worker-1");

        IngestionReport first = pipeline.ingest(lease, source(PLAYERS));
        List<ImportRow> afterFirst = rowRepository.rowsFor(lease.getBatch().getId());
        IngestionReport second = pipeline.ingest(lease, source(PLAYERS));
        List<ImportRow> afterSecond = rowRepository.rowsFor(lease.getBatch().getId());

        assertEquals(first.getTotalRows(), second.getTotalRows());
        assertEquals(4, afterSecond.size());
        for (int i = 0; i < afterFirst.size(); i++) {
            assertSame(afterFirst.get(i), afterSecond.get(i));
        }
    }

    @Test
    void testCrashRecoveryProducesUninterruptedRowCount() throws IOException {
        BatchLease crashed = claim("worker-a");
        UUID batchId = crashed.getBatch().getId();

        // Dies after the first chunk of two rows reached the store
        int firstChunkBytes = "E-mail,Name\na@x.com,Ann\nb@x.com,Bob\n".length();
        assertThrows(UncheckedIOException.class,
                () -> pipeline.ingest(crashed, new FailingInputStream(PLAYERS, firstChunkBytes)));
        assertEquals(2, rowRepository.rowsFor(batchId).size());

        batchRepository.ageHeartbeat(batchId, Duration.ofMinutes(10));
        ReaperResult reaped = batchRepository.reapStale(Duration.ofMinutes(5), 3);
        assertEquals(1, reaped.getReset());
        assertEquals(ImportBatch.BatchStatus.UPLOADED, batchRepository.get(batchId).getStatus());

        ImportBatch reclaimed = batchRepository.claimNext("worker-b", 3).orElseThrow();
        assertEquals(batchId, reclaimed.getId());
        assertEquals(2, reclaimed.getAttemptCount());
        IngestionReport report = pipeline.ingest(new BatchLease(reclaimed, "worker-b"), source(PLAYERS));

        assertEquals(4, report.getTotalRows());
        assertEquals(4, rowRepository.rowsFor(batchId).size());

        // The stale worker can no longer write
        assertThrows(LeaseLostException.class, () -> pipeline.ingest(crashed, source(PLAYERS + "e@x.com,Eve\n")));
        assertEquals(4, rowRepository.rowsFor(batchId).size());
    }

    @Test
    void testReclaimBySameWorkerFencesEarlierRun() throws IOException {
        BatchLease stale = claim("worker-a");
        UUID batchId = stale.getBatch().getId();

        batchRepository.ageHeartbeat(batchId, Duration.ofMinutes(10));
        assertEquals(1, batchRepository.reapStale(Duration.ofMinutes(5), 3).getReset());
        ImportBatch reclaimed = batchRepository.claimNext("worker-a", 3).orElseThrow();
        assertEquals(batchId, reclaimed.getId());
        assertEquals(2, reclaimed.getAttemptCount());
        BatchLease current = new BatchLease(reclaimed, "worker-a");

        assertFalse(batchRepository.heartbeat(stale.getBatch(), "worker-a", 2));
        assertThrows(LeaseLostException.class, () -> pipeline.ingest(stale, source(PLAYERS)));
        assertTrue(rowRepository.rowsFor(batchId).isEmpty());
        assertFalse(batchRepository.completeBatch(stale.getBatch(), "worker-a",
                IngestionReport.builder().totalRows(4).build()));
        assertFalse(batchRepository.failBatch(stale.getBatch(), "worker-a", BatchErrorCode.INTERNAL_ERROR));

        assertTrue(batchRepository.heartbeat(reclaimed, "worker-a", 0));
        IngestionReport report = pipeline.ingest(current, source(PLAYERS));
        assertEquals(4, report.getTotalRows());
        assertTrue(batchRepository.completeBatch(reclaimed, "worker-a", report));
        assertEquals(ImportBatch.BatchStatus.STAGED, batchRepository.get(batchId).getStatus());
    }

    private BatchLease claim(String workerId) {
        batchRepository.addUploaded(tenantId, "players.csv", "players.csv",
                ColumnMapping.ofHeaders(Map.of("email", "E-mail", "first_name", "Name")));
        ImportBatch batch = batchRepository.claimNext(workerId, 3).orElseThrow();
        return new BatchLease(batch, workerId);
    }

    private static InputStream source(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Serves the first {@code limit} bytes, then fails like a dropped connection.
     */
    private static final class FailingInputStream extends InputStream {
        private final byte[] data;
        private final int limit;
        private int position;

        private FailingInputStream(String content, int limit) {
            this.data = content.getBytes(StandardCharsets.US_ASCII);
            this.limit = limit;
        }

        @Override
        public int read() throws IOException {
            if (position >= limit) {
                throw new IOException("connection reset");
            }
            return data[position++];
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            if (position >= limit) {
                throw new IOException("connection reset");
            }
            int n = Math.min(len, limit - position);
            System.arraycopy(data, position, b, off, n);
            position += n;
            return n;
        }

        @Override
        public int available() {
            return 0;
        }
    }
}
