package com.supersoft.sparkpay.csv_ingestion_worker.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Decides whether an unexpected batch failure is worth another attempt.
 */
@Slf4j
@Component
public class FailureClassifier {

    // Patterns for transient failures
    private static final Pattern TRANSIENT_PATTERNS = Pattern.compile(
        "(?i).*(timeout|timed out|connection reset|deadlock|temporar|try again).*"
    );

    // Patterns for infrastructure failures
    private static final Pattern INFRASTRUCTURE_PATTERNS = Pattern.compile(
        "(?i).*(connection refused|too many connections|disk full|no space left|out of memory).*"
    );

    private static final int MAX_CAUSE_DEPTH = 10;

    /**
     * Classify a failure by walking its cause chain: exception types first, then messages.
     */
    public FailureType classifyFailure(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureType byType = classifyByType(current);
            if (byType != null) {
                return byType;
            }
            current = current.getCause();
        }

        current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            String message = current.getMessage();
            if (message != null) {
                if (TRANSIENT_PATTERNS.matcher(message).matches()) {
                    return FailureType.TRANSIENT;
                }
                if (INFRASTRUCTURE_PATTERNS.matcher(message).matches()) {
                    return FailureType.INFRASTRUCTURE;
                }
            }
            current = current.getCause();
        }

        // Default to permanent for programming and data errors
        return FailureType.PERMANENT;
    }

    /**
     * Transient and infrastructure failures release the batch for another claim.
     */
    public boolean isRetryable(FailureType failureType) {
        return failureType == FailureType.TRANSIENT || failureType == FailureType.INFRASTRUCTURE;
    }

    private FailureType classifyByType(Throwable failure) {
        if (failure instanceof TransientDataAccessException
                || failure instanceof RecoverableDataAccessException) {
            return FailureType.TRANSIENT;
        }
        if (failure instanceof DataAccessResourceFailureException) {
            return FailureType.INFRASTRUCTURE;
        }

        if (failure instanceof SQLException) {
            String sqlState = ((SQLException) failure).getSQLState();
            if (sqlState != null) {
                // serialization failure, deadlock detected
                if (sqlState.equals("40001") || sqlState.equals("40P01")) {
                    return FailureType.TRANSIENT;
                }
                // connection exception, insufficient resources
                if (sqlState.startsWith("08") || sqlState.startsWith("53")) {
                    return FailureType.INFRASTRUCTURE;
                }
            }
        }

        if (failure instanceof FileNotFoundException || failure instanceof AccessDeniedException) {
            return FailureType.INFRASTRUCTURE;
        }
        if (failure instanceof TimeoutException
                || failure instanceof UncheckedIOException
                || failure instanceof IOException) {
            return FailureType.TRANSIENT;
        }
        return null;
    }

    public enum FailureType {
        TRANSIENT,      // Temporary issues that might succeed on retry
        PERMANENT,      // Programming or data errors that won't succeed on retry
        INFRASTRUCTURE  // System issues that need attention
    }
}
