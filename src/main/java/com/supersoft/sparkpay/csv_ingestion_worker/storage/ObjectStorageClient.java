package com.supersoft.sparkpay.csv_ingestion_worker.storage;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

/**
 * Read side of the object-storage collaborator that holds uploaded batch sources.
 */
public interface ObjectStorageClient {

    /**
     * Issues a read handle for {@code sourcePointer} valid for {@code ttl}.
     *
     * @throws IOException if the object does not exist or the pointer is outside this store
     */
    ReadHandle createReadHandle(String sourcePointer, Duration ttl) throws IOException;

    /**
     * Opens the object behind {@code handle} for incremental reading. The caller closes the stream.
     *
     * @throws IOException if the handle expired or the object can no longer be read
     */
    InputStream open(ReadHandle handle) throws IOException;
}
