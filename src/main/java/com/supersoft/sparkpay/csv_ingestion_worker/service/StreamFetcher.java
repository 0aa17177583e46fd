package com.supersoft.sparkpay.csv_ingestion_worker.service;

import com.supersoft.sparkpay.csv_ingestion_worker.domain.ImportBatch;
import com.supersoft.sparkpay.csv_ingestion_worker.exception.SourceUnavailableException;
import com.supersoft.sparkpay.csv_ingestion_worker.storage.ObjectStorageClient;
import com.supersoft.sparkpay.csv_ingestion_worker.storage.ReadHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

@Slf4j
@Service
public class StreamFetcher {

    @Autowired
    private ObjectStorageClient storageClient;

    @Value("${ingestion.storage.read-handle-ttl-seconds:600}")
    private long readHandleTtlSeconds;

    /**
     * Opens the batch source through a short-lived read handle. The returned stream is read
     * incrementally and must be closed by the caller.
     *
     * @throws SourceUnavailableException if the object is missing, expired or outside the store
     */
    public InputStream openStream(ImportBatch batch) {
        if (batch.getSourcePointer() == null || batch.getSourcePointer().isBlank()) {
            throw new SourceUnavailableException("Batch " + batch.getId() + " has no source pointer");
        }
        try {
            ReadHandle handle = storageClient.createReadHandle(batch.getSourcePointer(),
                    Duration.ofSeconds(readHandleTtlSeconds));
            log.debug("Issued read handle for batch {} expiring at {}", batch.getId(), handle.getExpiresAt());
            return storageClient.open(handle);
        } catch (IOException e) {
            throw new SourceUnavailableException(
                    "Source for batch " + batch.getId() + " is unavailable: " + e.getMessage(), e);
        }
    }
}
