package com.supersoft.sparkpay.csv_ingestion_worker.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Final ingestion report written to {@code import_batch.report_summary}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {

    @JsonProperty("total_rows")
    private int totalRows;

    @JsonProperty("staged_count")
    private int stagedCount;

    @JsonProperty("error_count")
    private int errorCount;

    @JsonProperty("started_at")
    private String startedAt;

    @JsonProperty("completed_at")
    private String completedAt;

    @JsonProperty("duration_ms")
    private long durationMs;
}
