package com.supersoft.sparkpay.csv_ingestion_worker.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Published by the upload collaborator when a batch reaches UPLOADED. Only a hint to poll now;
 * it grants no ownership.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchUploadedMessage {
    private UUID batchId;
    private UUID tenantId;
}
