package com.supersoft.sparkpay.csv_ingestion_worker.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class BatchUploadedListener {

    @Autowired
    private IngestionPollLoop pollLoop;

    @RabbitListener(queues = "${ingestion.amqp.queue:ingestion.batch.uploaded}",
            autoStartup = "${ingestion.amqp.enabled:true}")
    public void onBatchUploaded(BatchUploadedMessage message) {
        log.info("Batch uploaded: batchId={}, tenantId={}", message.getBatchId(), message.getTenantId());
        try {
            int dispatched = pollLoop.pollOnce();
            log.debug("Upload notification for batch {} dispatched {} batches", message.getBatchId(), dispatched);
        } catch (DataAccessException e) {
            log.warn("Poll triggered by batch {} failed, next scheduled poll will retry: {}",
                    message.getBatchId(), e.getMessage());
        }
    }
}
