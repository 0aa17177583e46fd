package com.supersoft.sparkpay.csv_ingestion_worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CsvIngestionWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CsvIngestionWorkerApplication.class, args);
    }
}
