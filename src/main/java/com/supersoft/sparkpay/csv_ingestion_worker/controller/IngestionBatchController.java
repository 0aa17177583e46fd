package com.supersoft.sparkpay.csv_ingestion_worker.controller;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportRow;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.ImportBatchRepository;
import com.supersoft.sparkpay.csv_ingestion_worker.repository.ImportRowRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/ingestion")
@Tag(name = "Ingestion Batches", description = "Read models over staged import batches and their rows")
public class IngestionBatchController {

    static final String TENANT_HEADER = "X-Tenant-Id";
    static final int MAX_PAGE_SIZE = 500;

    @Autowired
    private ImportBatchRepository batchRepository;

    @Autowired
    private ImportRowRepository rowRepository;

    @Operation(summary = "Get batch status",
               description = "Lifecycle state, progress and final report of one import batch")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Batch found",
                    content = @Content(schema = @Schema(example = """
                    {
                      "batchId": "6f1c2a9e-3f0b-4a55-9d0e-1c2b3a4d5e6f",
                      "status": "STAGED",
                      "originalFileName": "players.csv",
                      "totalRows": 2,
                      "attemptCount": 1,
                      "reportSummary": {
                        "total_rows": 2,
                        "staged_count": 1,
                        "error_count": 1,
                        "started_at": "2024-05-01T10:00:00Z",
                        "completed_at": "2024-05-01T10:00:01Z",
                        "duration_ms": 840
                      },
                      "lastErrorCode": null
                    }
                    """))),
        @ApiResponse(responseCode = "404", description = "Batch not found for this tenant"),
        @ApiResponse(responseCode = "500", description = "Internal server error",
                    content = @Content(schema = @Schema(example = """
                    {
                      "error": "Status check failed"
                    }
                    """)))
    })
    @GetMapping("/batches/{batchId}")
    public ResponseEntity<?> getBatch(
            @Parameter(description = "Tenant that owns the batch", required = true)
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Parameter(description = "Batch ID", required = true)
            @PathVariable UUID batchId) {
        try {
            Optional<ImportBatch> batchOpt = batchRepository.findById(tenantId, batchId);
            if (batchOpt.isEmpty()) {
                return ResponseEntity.notFound().build();
            }

            ImportBatch batch = batchOpt.get();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("batchId", batch.getId());
            body.put("status", batch.getStatus());
            body.put("originalFileName", batch.getOriginalFileName());
            body.put("totalRows", batch.getTotalRows());
            body.put("attemptCount", batch.getAttemptCount());
            body.put("reportSummary", batch.getReportSummary());
            body.put("lastErrorCode", batch.getLastErrorCode());
            body.put("lastErrorAt", batch.getLastErrorAt());
            body.put("createdAt", batch.getCreatedAt());
            body.put("updatedAt", batch.getUpdatedAt());
            return ResponseEntity.ok(body);

        } catch (Exception e) {
            log.error("Error getting batch status {}", batchId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Status check failed"));
        }
    }

    @Operation(summary = "List batch rows",
               description = "Staged and rejected rows of a batch in source order, optionally filtered by status")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Rows retrieved successfully",
                    content = @Content(schema = @Schema(example = """
                    {
                      "rows": [
                        {
                          "rowNumber": 2,
                          "status": "ERROR",
                          "reasonCode": "MISSING_IDENTIFIER",
                          "reasonDetail": "at least one of email, phone or external_id is required",
                          "rawPayload": { "e-mail": "" }
                        }
                      ],
                      "pagination": {
                        "page": 0,
                        "size": 50,
                        "totalElements": 1,
                        "totalPages": 1
                      }
                    }
                    """))),
        @ApiResponse(responseCode = "400", description = "Invalid status filter or page parameters"),
        @ApiResponse(responseCode = "404", description = "Batch not found for this tenant")
    })
    @GetMapping("/batches/{batchId}/rows")
    public ResponseEntity<?> getRows(
            @Parameter(description = "Tenant that owns the batch", required = true)
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @Parameter(description = "Batch ID", required = true)
            @PathVariable UUID batchId,
            @Parameter(description = "Filter by row status (STAGED, ERROR)")
            @RequestParam(value = "status", required = false) String status,
            @Parameter(description = "Page number (0-based)")
            @RequestParam(value = "page", defaultValue = "0") int page,
            @Parameter(description = "Number of rows per page")
            @RequestParam(value = "size", defaultValue = "50") int size) {

        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE));
        }

        ImportRow.RowStatus rowStatus = null;
        if (status != null && !status.isBlank()) {
            try {
                rowStatus = ImportRow.RowStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest()
                        .body(Map.of("error", "Unknown row status: " + status));
            }
        }

        try {
            if (batchRepository.findById(tenantId, batchId).isEmpty()) {
                return ResponseEntity.notFound().build();
            }

            List<ImportRow> rows = rowRepository.findByBatch(tenantId, batchId, rowStatus, page, size);
            long totalElements = rowRepository.countByBatch(tenantId, batchId, rowStatus);
            long totalPages = (totalElements + size - 1) / size;

            List<Map<String, Object>> rowBodies = rows.stream()
                    .map(this::toRowBody)
                    .collect(Collectors.toList());

            return ResponseEntity.ok(Map.of(
                    "rows", rowBodies,
                    "pagination", Map.of(
                            "page", page,
                            "size", size,
                            "totalElements", totalElements,
                            "totalPages", totalPages
                    )
            ));

        } catch (Exception e) {
            log.error("Error listing rows for batch {}", batchId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Row listing failed"));
        }
    }

    private Map<String, Object> toRowBody(ImportRow row) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("rowNumber", row.getRowNumber());
        body.put("status", row.getStatus());
        body.put("reasonCode", row.getReasonCode());
        body.put("reasonDetail", row.getReasonDetail());
        body.put("rawPayload", row.getRawPayload());
        body.put("normalizedPayload", row.getNormalizedPayload());
        return body;
    }
}
