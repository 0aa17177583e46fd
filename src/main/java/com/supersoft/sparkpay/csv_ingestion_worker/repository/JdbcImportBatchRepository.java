package com.supersoft.sparkpay.csv_ingestion_worker.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.BatchErrorCode;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ColumnMapping;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.IngestionReport;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ReaperResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL implementation. Status values are written as literals; every other value is bound.
 * Lease writes are fenced on {@code attempt_count} as returned by the claim, so a run that was reaped
 * and reclaimed by the same worker id cannot touch the new attempt.
 */
@Slf4j
@Repository
public class JdbcImportBatchRepository implements ImportBatchRepository {

    static final String FAIL_EXHAUSTED_SQL =
            "UPDATE import_batch SET status = 'FAILED', last_error_code = ?, last_error_at = NOW(), updated_at = NOW() " +
            "WHERE id IN (SELECT id FROM import_batch WHERE status = 'UPLOADED' AND attempt_count >= ? " +
            "FOR UPDATE SKIP LOCKED)";

    static final String CLAIM_SQL =
            "UPDATE import_batch SET status = 'PARSING', claimed_by = ?, claimed_at = NOW(), heartbeat_at = NOW(), " +
            "attempt_count = attempt_count + 1, updated_at = NOW() " +
            "WHERE id = (SELECT id FROM import_batch WHERE status = 'UPLOADED' AND attempt_count < ? " +
            "ORDER BY created_at ASC LIMIT 1 FOR UPDATE SKIP LOCKED) " +
            "RETURNING *";

    static final String HEARTBEAT_SQL =
            "UPDATE import_batch SET heartbeat_at = NOW(), total_rows = ?, updated_at = NOW() " +
            "WHERE id = ? AND tenant_id = ? AND claimed_by = ? AND attempt_count = ? AND status = 'PARSING'";

    static final String COMPLETE_SQL =
            "UPDATE import_batch SET status = 'STAGED', total_rows = ?, report_summary = ?::jsonb, " +
            "heartbeat_at = NOW(), updated_at = NOW() " +
            "WHERE id = ? AND tenant_id = ? AND claimed_by = ? AND attempt_count = ? AND status = 'PARSING'";

    static final String FAIL_SQL =
            "UPDATE import_batch SET status = 'FAILED', last_error_code = ?, last_error_at = NOW(), updated_at = NOW() " +
            "WHERE id = ? AND tenant_id = ? AND claimed_by = ? AND attempt_count = ? AND status = 'PARSING'";

    static final String RELEASE_SQL =
            "UPDATE import_batch SET " +
            "status = CASE WHEN attempt_count < ? THEN 'UPLOADED' ELSE 'FAILED' END, " +
            "last_error_code = CASE WHEN attempt_count < ? THEN ? ELSE 'MAX_ATTEMPTS_EXCEEDED' END, " +
            "last_error_at = NOW(), claimed_by = NULL, claimed_at = NULL, heartbeat_at = NULL, updated_at = NOW() " +
            "WHERE id = ? AND tenant_id = ? AND claimed_by = ? AND attempt_count = ? AND status = 'PARSING'";

    static final String REAP_FAIL_SQL =
            "UPDATE import_batch SET status = 'FAILED', last_error_code = 'WORKER_LOST', last_error_at = NOW(), " +
            "updated_at = NOW() " +
            "WHERE id IN (SELECT id FROM import_batch WHERE status = 'PARSING' " +
            "AND heartbeat_at < NOW() - (? * INTERVAL '1 millisecond') AND attempt_count >= ? " +
            "FOR UPDATE SKIP LOCKED)";

    static final String REAP_RESET_SQL =
            "UPDATE import_batch SET status = 'UPLOADED', claimed_by = NULL, claimed_at = NULL, heartbeat_at = NULL, " +
            "updated_at = NOW() " +
            "WHERE id IN (SELECT id FROM import_batch WHERE status = 'PARSING' " +
            "AND heartbeat_at < NOW() - (? * INTERVAL '1 millisecond') AND attempt_count < ? " +
            "FOR UPDATE SKIP LOCKED)";

    static final String FIND_BY_ID_SQL = "SELECT * FROM import_batch WHERE id = ? AND tenant_id = ?";

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private final RowMapper<ImportBatch> rowMapper = this::mapBatch;

    @Override
    @Transactional
    public Optional<ImportBatch> claimNext(String workerId, int maxAttempts) {
        int exhausted = jdbcTemplate.update(FAIL_EXHAUSTED_SQL, BatchErrorCode.MAX_ATTEMPTS_EXCEEDED.name(), maxAttempts);
        if (exhausted > 0) {
            log.warn("Failed {} uploaded batches that exhausted {} attempts", exhausted, maxAttempts);
        }

        List<ImportBatch> claimed = jdbcTemplate.query(CLAIM_SQL, rowMapper, workerId, maxAttempts);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        ImportBatch batch = claimed.get(0);
        log.info("Worker {} claimed batch {} (attempt {})", workerId, batch.getId(), batch.getAttemptCount());
        return Optional.of(batch);
    }

    @Override
    public boolean heartbeat(ImportBatch batch, String workerId, int rowsProcessed) {
        int updated = jdbcTemplate.update(HEARTBEAT_SQL,
                rowsProcessed, batch.getId(), batch.getTenantId(), workerId, batch.getAttemptCount());
        return updated > 0;
    }

    @Override
    public boolean completeBatch(ImportBatch batch, String workerId, IngestionReport report) {
        int updated = jdbcTemplate.update(COMPLETE_SQL,
                report.getTotalRows(), toJson(report), batch.getId(), batch.getTenantId(), workerId,
                batch.getAttemptCount());
        if (updated == 0) {
            log.warn("Batch {} could not be completed - lease no longer held by {}", batch.getId(), workerId);
            return false;
        }
        return true;
    }

    @Override
    public boolean failBatch(ImportBatch batch, String workerId, BatchErrorCode errorCode) {
        int updated = jdbcTemplate.update(FAIL_SQL,
                errorCode.name(), batch.getId(), batch.getTenantId(), workerId, batch.getAttemptCount());
        if (updated == 0) {
            log.warn("Batch {} could not be failed with {} - lease no longer held by {}",
                    batch.getId(), errorCode, workerId);
            return false;
        }
        return true;
    }

    @Override
    public boolean releaseBatch(ImportBatch batch, String workerId, BatchErrorCode errorCode, int maxAttempts) {
        int updated = jdbcTemplate.update(RELEASE_SQL,
                maxAttempts, maxAttempts, errorCode.name(), batch.getId(), batch.getTenantId(), workerId, batch.getAttemptCount());
        return updated > 0;
    }

    @Override
    @Transactional
    public ReaperResult reapStale(Duration staleThreshold, int maxAttempts) {
        long thresholdMs = staleThreshold.toMillis();
        int failed = jdbcTemplate.update(REAP_FAIL_SQL, thresholdMs, maxAttempts);
        int reset = jdbcTemplate.update(REAP_RESET_SQL, thresholdMs, maxAttempts);
        return new ReaperResult(reset, failed);
    }

    @Override
    public Optional<ImportBatch> findById(UUID tenantId, UUID batchId) {
        List<ImportBatch> batches = jdbcTemplate.query(FIND_BY_ID_SQL, rowMapper, batchId, tenantId);
        return batches.isEmpty() ? Optional.empty() : Optional.of(batches.get(0));
    }

    private ImportBatch mapBatch(ResultSet rs, int rowNum) throws SQLException {
        UUID id = rs.getObject("id", UUID.class);
        return ImportBatch.builder()
                .id(id)
                .tenantId(rs.getObject("tenant_id", UUID.class))
                .status(ImportBatch.BatchStatus.valueOf(rs.getString("status")))
                .sourcePointer(rs.getString("source_pointer"))
                .originalFileName(rs.getString("original_file_name"))
                .columnMapping(readColumnMapping(id, rs.getString("column_mapping")))
                .claimedBy(rs.getString("claimed_by"))
                .claimedAt(toLocalDateTime(rs.getTimestamp("claimed_at")))
                .heartbeatAt(toLocalDateTime(rs.getTimestamp("heartbeat_at")))
                .attemptCount(rs.getInt("attempt_count"))
                .totalRows(rs.getInt("total_rows"))
                .reportSummary(readReport(id, rs.getString("report_summary")))
                .lastErrorCode(rs.getString("last_error_code"))
                .lastErrorAt(toLocalDateTime(rs.getTimestamp("last_error_at")))
                .createdAt(toLocalDateTime(rs.getTimestamp("created_at")))
                .updatedAt(toLocalDateTime(rs.getTimestamp("updated_at")))
                .build();
    }

    /**
     * An unreadable mapping maps to null so the claimed batch can still be failed by the worker
     * instead of blocking the claim query on every poll.
     */
    private ColumnMapping readColumnMapping(UUID batchId, String json) {
        if (json == null) {
            return ColumnMapping.empty();
        }
        try {
            return objectMapper.readValue(json, ColumnMapping.class);
        } catch (JsonProcessingException e) {
            log.error("Unreadable column_mapping on batch {}: {}", batchId, e.getMessage());
            return null;
        }
    }

    private IngestionReport readReport(UUID batchId, String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, IngestionReport.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable report_summary on batch {}: {}", batchId, e.getMessage());
            return null;
        }
    }

    private String toJson(IngestionReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize ingestion report", e);
        }
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
