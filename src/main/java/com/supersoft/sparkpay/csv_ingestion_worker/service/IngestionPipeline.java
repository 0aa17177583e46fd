package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ColumnMapping;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.IngestionReport;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.NormalizedRow;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.RowOutcome;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.BatchFatalException;
import com.supersoft.sparkpay.csv_ingestion_worker.util.HeaderNormalizer;
import com.supersoft.sparkpay.csv_ingestion_worker.util.TabularStreamParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Streams one batch source through parse, normalize, validate and chunked write. Holds at most one
 * chunk of outcomes in memory.
 */
@Slf4j
@Service
public class IngestionPipeline {

    @Autowired
    private RowNormalizer rowNormalizer;

    @Autowired
    private RowValidator rowValidator;

    @Autowired
    private ChunkedRowWriter rowWriter;

    @Value("${ingestion.row-cap:10000}")
    private int rowCap;

    @Value("${ingestion.csv.delimiter:,}")
    private char delimiter;

    /**
     * Ingests every data record of {@code source} for the leased batch.
     *
     * @return the report for a fully consumed source
     * @throws BatchFatalException with ROW_LIMIT_EXCEEDED when the source holds more than the row cap;
     *                             the partial chunk at that point is never written
     */
    public IngestionReport ingest(BatchLease lease, InputStream source) throws IOException {
        ImportBatch batch = lease.getBatch();
        ColumnMapping mapping = batch.getColumnMapping();
        Instant startedAt = Instant.now();

        int rowNumber = 0;
        int stagedCount = 0;
        int errorCount = 0;
        List<RowOutcome> chunk = new ArrayList<>(rowWriter.getChunkSize());

        try (TabularStreamParser parser = TabularStreamParser.open(source, delimiter)) {
            if (!parser.hasNext()) {
                log.info("Batch {} source is empty", batch.getId());
            } else {
                List<String> headers = HeaderNormalizer.normalizeHeaders(parser.next());
                log.info("Batch {} headers: {}", batch.getId(), headers);

                while (parser.hasNext()) {
                    List<String> record = parser.next();
                    rowNumber++;
                    if (rowNumber > rowCap) {
                        throw new BatchFatalException(BatchErrorCode.ROW_LIMIT_EXCEEDED,
                                "Batch " + batch.getId() + " exceeds the row cap of " + rowCap);
                    }

                    NormalizedRow row = rowNormalizer.normalize(headers, record, mapping, rowNumber,
                            batch.getOriginalFileName());
                    RowOutcome outcome = rowValidator.validate(row);
                    if (outcome.isStaged()) {
                        stagedCount++;
                    } else {
                        errorCount++;
                    }
                    chunk.add(outcome);

                    if (chunk.size() >= rowWriter.getChunkSize()) {
                        rowWriter.writeChunk(lease, chunk);
                        chunk.clear();
                        lease.recordProgress(rowNumber);
                    }
                }
            }

            if (!chunk.isEmpty()) {
                rowWriter.writeChunk(lease, chunk);
                chunk.clear();
                lease.recordProgress(rowNumber);
            }
        }

        Instant completedAt = Instant.now();
        log.info("Batch {} ingested: {} rows, {} staged, {} errors", batch.getId(), rowNumber, stagedCount, errorCount);
        return IngestionReport.builder()
                .totalRows(rowNumber)
                .stagedCount(stagedCount)
                .errorCount(errorCount)
                .startedAt(startedAt.toString())
                .completedAt(completedAt.toString())
                .durationMs(completedAt.toEpochMilli() - startedAt.toEpochMilli())
                .build();
    }
}
