package com.supersoft.sparkpay.csv_ingestion_worker.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportPlayerPayload;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportRow;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.LeaseLostException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.test.util.ReflectionTestUtils;

import java.sql.Statement;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcImportRowRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @InjectMocks
    private JdbcImportRowRepository repository;

    private ImportBatch batch;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(repository, "objectMapper", new ObjectMapper());
        batch = ImportBatch.builder()
                .id(UUID.randomUUID())
                .tenantId(UUID.randomUUID())
                .status(ImportBatch.BatchStatus.PARSING)
                .attemptCount(1)
                .build();
    }

    @Test
    void testEmptyChunkTouchesNothing() {
        assertEquals(0, repository.insertChunk(batch, "worker-1", Collections.emptyList()));
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void testChunkRejectedWhenLeaseNotHeld() {
        when(jdbcTemplate.queryForList(JdbcImportRowRepository.LOCK_OWNED_BATCH_SQL, Integer.class,
                batch.getId(), batch.getTenantId(), "worker-1", 1))
                .thenReturn(Collections.emptyList());

        assertThrows(LeaseLostException.class,
                () -> repository.insertChunk(batch, "worker-1", List.of(stagedRow(1))));
        verify(jdbcTemplate, never()).batchUpdate(anyString(), anyList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReplayedRowsAreNotCounted() {
        when(jdbcTemplate.queryForList(JdbcImportRowRepository.LOCK_OWNED_BATCH_SQL, Integer.class,
                batch.getId(), batch.getTenantId(), "worker-1", 1))
                .thenReturn(List.of(1));
        when(jdbcTemplate.batchUpdate(eq(JdbcImportRowRepository.INSERT_SQL), anyList()))
                .thenReturn(new int[]{1, 0, Statement.SUCCESS_NO_INFO});

        int inserted = repository.insertChunk(batch, "worker-1",
                List.of(stagedRow(1), stagedRow(2), errorRow(3)));

        assertEquals(1, inserted);
        ArgumentCaptor<List<Object[]>> captor = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(eq(JdbcImportRowRepository.INSERT_SQL), captor.capture());
        List<Object[]> params = captor.getValue();
        assertEquals(3, params.size());

        Object[] staged = params.get(0);
        assertEquals(batch.getId(), staged[0]);
        assertEquals(batch.getTenantId(), staged[1]);
        assertEquals(1, staged[2]);
        assertEquals("{\"email\":\"a@x.com\"}", staged[3]);
        assertTrue(((String) staged[4]).contains("\"contract_version\":\"v1\""));
        assertEquals("STAGED", staged[5]);

        Object[] rejected = params.get(2);
        assertNull(rejected[4]);
        assertEquals("ERROR", rejected[5]);
        assertEquals("MISSING_IDENTIFIER", rejected[6]);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFindByBatchAppliesStatusFilterAndPaging() {
        UUID tenantId = batch.getTenantId();
        UUID batchId = batch.getId();
        when(jdbcTemplate.query(
                eq("SELECT * FROM import_row WHERE batch_id = ? AND tenant_id = ? AND status = ? " +
                        "ORDER BY row_number ASC LIMIT ? OFFSET ?"),
                any(RowMapper.class), eq(batchId), eq(tenantId), eq("ERROR"), eq(50), eq(100L)))
                .thenReturn(Collections.emptyList());

        assertTrue(repository.findByBatch(tenantId, batchId, ImportRow.RowStatus.ERROR, 2, 50).isEmpty());
    }

    @Test
    void testCountByBatchWithoutFilter() {
        UUID tenantId = batch.getTenantId();
        UUID batchId = batch.getId();
        when(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM import_row WHERE batch_id = ? AND tenant_id = ?", Long.class, batchId, tenantId))
                .thenReturn(7L);

        assertEquals(7L, repository.countByBatch(tenantId, batchId, null));
    }

    private ImportRow stagedRow(int rowNumber) {
        return ImportRow.builder()
                .rowNumber(rowNumber)
                .rawPayload(Map.of("email", "a@x.com"))
                .normalizedPayload(ImportPlayerPayload.builder()
                        .rowRef(new ImportPlayerPayload.RowRef(rowNumber))
                        .build())
                .status(ImportRow.RowStatus.STAGED)
                .build();
    }

    private ImportRow errorRow(int rowNumber) {
        return ImportRow.builder()
                .rowNumber(rowNumber)
                .rawPayload(Map.of("email", ""))
                .status(ImportRow.RowStatus.ERROR)
                .reasonCode("MISSING_IDENTIFIER")
                .reasonDetail("at least one of email, phone or external_id is required")
                .build();
    }
}
