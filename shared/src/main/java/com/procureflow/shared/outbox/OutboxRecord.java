package com.procureflow.shared.outbox;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Outbox record, persisted alongside domain state in the same transaction.
 *
 *   1. BEGIN TRANSACTION
 *      UPDATE budgets / purchase_orders ...   -- business state
 *      INSERT INTO outbox (event...)          -- event record
 *   2. COMMIT
 *   3. Background relay reads outbox, publishes to Kafka, marks published
 *
 * Either both the state change and the event record are committed, or neither is.
 */
@Entity
@Table(name = "outbox", indexes = {
    @Index(name = "idx_outbox_unpublished",
           columnList = "published_at, retry_count, created_at"),
    @Index(name = "idx_outbox_aggregate",
           columnList = "aggregate_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxRecord {

    public static final int MAX_RETRIES = 5;
    private static final int MAX_ERROR_LENGTH = 2000;
    private static final long BASE_BACKOFF_SECONDS = 5L;

    /** Same UUID as the event ID */
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "topic", nullable = false, length = 200)
    private String topic;

    /** Partition key used when relaying (the PO id) */
    @Column(name = "partition_key", length = 100)
    private String partitionKey;

    /** Full serialized event JSON */
    @Column(name = "payload", nullable = false, length = 16000)
    private String payload;

    /** NULL until successfully published to Kafka */
    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    /** Relay skips records where nextRetryAt > NOW() */
    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onPrePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onPreUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isExhausted() {
        return retryCount >= MAX_RETRIES;
    }

    public void markPublished(Instant at) {
        this.publishedAt = at;
        this.updatedAt = at;
    }

    /** Counts a failed attempt; the next one is due 5s, 10s, 20s, 40s, 80s later. */
    public void recordFailure(String errorMessage, Instant at) {
        retryCount++;
        lastError = errorMessage == null || errorMessage.length() <= MAX_ERROR_LENGTH
                ? errorMessage : errorMessage.substring(0, MAX_ERROR_LENGTH);
        nextRetryAt = at.plusSeconds(BASE_BACKOFF_SECONDS << (retryCount - 1));
        updatedAt = at;
    }
}
