package com.procureflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PO Approval Engine: Entry Point
 *
 * Routing, budget reservation and approval orchestration for purchase orders.
 * Scans com.procureflow.engine and the shared outbox/Kafka/idempotency components.
 *
 * Port: 8080 (see application.yml)
 */
@SpringBootApplication
public class PoApprovalEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(PoApprovalEngineApplication.class, args);
    }
}
