package com.supersoft.sparkpay.csv_ingestion_worker.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchUploadedListenerTest {

    @Mock
    private IngestionPollLoop pollLoop;

    @InjectMocks
    private BatchUploadedListener listener;

    @Test
    void testNotificationTriggersPoll() {
        when(pollLoop.pollOnce()).thenReturn(1);

        listener.onBatchUploaded(message());

        verify(pollLoop).pollOnce();
    }

    @Test
    void testStoreFailureLeavesMessageAcknowledged() {
        when(pollLoop.pollOnce()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertDoesNotThrow(() -> listener.onBatchUploaded(message()));
    }

    private BatchUploadedMessage message() {
        return BatchUploadedMessage.builder()
                .batchId(UUID.randomUUID())
                .tenantId(UUID.randomUUID())
                .build();
    }
}
