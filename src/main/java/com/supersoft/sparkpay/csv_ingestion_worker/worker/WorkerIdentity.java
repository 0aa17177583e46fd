package com.supersoft.sparkpay.csv_ingestion_worker.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Id this process records in {@code claimed_by}. Unique per process so two replicas on one host
 * never share a lease.
 */
@Slf4j
@Component
public class WorkerIdentity {

    @Value("${ingestion.worker-id:}")
    private String configuredWorkerId;

    private volatile String workerId;

    public String getWorkerId() {
        String id = workerId;
        if (id == null) {
            synchronized (this) {
                if (workerId == null) {
                    workerId = resolve();
                    log.info("Worker id: {}", workerId);
                }
                id = workerId;
            }
        }
        return id;
    }

    private String resolve() {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId.trim();
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve hostname for worker id: {}", e.getMessage());
            host = "worker";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
