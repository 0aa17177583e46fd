package com.supersoft.sparkpay.csv_ingestion_worker.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportPlayerPayload;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportRow;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.LeaseLostException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Repository
public class JdbcImportRowRepository implements ImportRowRepository {

    /** Holds a share lock on the batch row so the reaper cannot reassign it mid-chunk. */
    static final String LOCK_OWNED_BATCH_SQL =
            "SELECT 1 FROM import_batch WHERE id = ? AND tenant_id = ? AND claimed_by = ? AND attempt_count = ? " +
            "AND status = 'PARSING' FOR SHARE";

    static final String INSERT_SQL =
            "INSERT INTO import_row (batch_id, tenant_id, row_number, raw_payload, normalized_payload, status, " +
            "reason_code, reason_detail) VALUES (?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?) " +
            "ON CONFLICT (batch_id, row_number) DO NOTHING";

    private static final TypeReference<Map<String, String>> RAW_PAYLOAD_TYPE = new TypeReference<>() {
    };

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private final RowMapper<ImportRow> rowMapper = this::mapRow;

    @Override
    @Transactional
    public int insertChunk(ImportBatch batch, String workerId, List<ImportRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }

        List<Integer> owned = jdbcTemplate.queryForList(LOCK_OWNED_BATCH_SQL, Integer.class,
                batch.getId(), batch.getTenantId(), workerId, batch.getAttemptCount());
        if (owned.isEmpty()) {
            throw new LeaseLostException(batch.getId(), workerId);
        }

        List<Object[]> params = new ArrayList<>(rows.size());
        for (ImportRow row : rows) {
            params.add(new Object[]{
                    batch.getId(),
                    batch.getTenantId(),
                    row.getRowNumber(),
                    toJson(row.getRawPayload()),
                    row.getNormalizedPayload() != null ? toJson(row.getNormalizedPayload()) : null,
                    row.getStatus().name(),
                    row.getReasonCode(),
                    row.getReasonDetail()
            });
        }

        int[] counts = jdbcTemplate.batchUpdate(INSERT_SQL, params);
        int inserted = 0;
        for (int count : counts) {
            if (count > 0) {
                inserted += count;
            }
        }
        log.debug("Inserted {} of {} rows for batch {}", inserted, rows.size(), batch.getId());
        return inserted;
    }

    @Override
    public List<ImportRow> findByBatch(UUID tenantId, UUID batchId, ImportRow.RowStatus status, int page, int size) {
        StringBuilder sql = new StringBuilder("SELECT * FROM import_row WHERE batch_id = ? AND tenant_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(batchId);
        params.add(tenantId);

        if (status != null) {
            sql.append(" AND status = ?");
            params.add(status.name());
        }

        sql.append(" ORDER BY row_number ASC LIMIT ? OFFSET ?");
        params.add(size);
        params.add((long) page * size);

        return jdbcTemplate.query(sql.toString(), rowMapper, params.toArray());
    }

    @Override
    public long countByBatch(UUID tenantId, UUID batchId, ImportRow.RowStatus status) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM import_row WHERE batch_id = ? AND tenant_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(batchId);
        params.add(tenantId);

        if (status != null) {
            sql.append(" AND status = ?");
            params.add(status.name());
        }

        Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    private ImportRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return ImportRow.builder()
                .batchId(rs.getObject("batch_id", UUID.class))
                .tenantId(rs.getObject("tenant_id", UUID.class))
                .rowNumber(rs.getInt("row_number"))
                .rawPayload(readRawPayload(rs.getString("raw_payload")))
                .normalizedPayload(readPayload(rs.getString("normalized_payload")))
                .status(ImportRow.RowStatus.valueOf(rs.getString("status")))
                .reasonCode(rs.getString("reason_code"))
                .reasonDetail(rs.getString("reason_detail"))
                .createdAt(rs.getTimestamp("created_at") != null ? rs.getTimestamp("created_at").toLocalDateTime() : null)
                .build();
    }

    private Map<String, String> readRawPayload(String json) throws SQLException {
        if (json == null) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, RAW_PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable raw_payload", e);
        }
    }

    private ImportPlayerPayload readPayload(String json) throws SQLException {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ImportPlayerPayload.class);
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable normalized_payload", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize row payload", e);
        }
    }
}
