package com.supersoft.sparkpay.csv_ingestion_worker.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Serves uploaded objects from a directory shared with the upload collaborator.
 * Source pointers are paths relative to {@code ingestion.storage.base-path}.
 */
@Slf4j
@Component
public class LocalObjectStorageClient implements ObjectStorageClient {

    private static final int READ_BUFFER_BYTES = 64 * 1024;

    @Value("${ingestion.storage.base-path:uploads}")
    private String basePath;

    private Clock clock = Clock.systemUTC();

    @Override
    public ReadHandle createReadHandle(String sourcePointer, Duration ttl) throws IOException {
        Path path = resolve(sourcePointer);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("Source object not found: " + sourcePointer);
        }
        Instant expiresAt = clock.instant().plus(ttl);
        log.debug("Issued read handle for {} valid until {}", sourcePointer, expiresAt);
        return new ReadHandle(sourcePointer, expiresAt);
    }

    @Override
    public InputStream open(ReadHandle handle) throws IOException {
        if (handle.isExpired(clock.instant())) {
            throw new AccessDeniedException(handle.getSourcePointer(), null, "read handle expired");
        }
        Path path = resolve(handle.getSourcePointer());
        return new BufferedInputStream(Files.newInputStream(path), READ_BUFFER_BYTES);
    }

    private Path resolve(String sourcePointer) throws IOException {
        if (sourcePointer == null || sourcePointer.isBlank()) {
            throw new FileNotFoundException("Empty source pointer");
        }
        Path baseDir = Paths.get(basePath).toAbsolutePath().normalize();
        Path path = baseDir.resolve(sourcePointer).normalize();
        if (!path.startsWith(baseDir)) {
            throw new AccessDeniedException(sourcePointer, null, "pointer escapes storage base path");
        }
        return path;
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }
}
