package com.procureflow.shared.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxRecord, String> {

    /**
     * Fetch unpublished records eligible for relay.
     * SKIP LOCKED lets several relay instances drain different records concurrently.
     */
    @Query(value = """
        SELECT * FROM outbox
        WHERE published_at IS NULL
          AND retry_count < 5
          AND (next_retry_at IS NULL OR next_retry_at <= :now)
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxRecord> findUnpublishedForRelay(@Param("now") Instant now, @Param("limit") int limit);

    List<OutboxRecord> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);

    @Query("SELECT COUNT(o) FROM OutboxRecord o WHERE o.publishedAt IS NULL AND o.retryCount < 5")
    long countUnpublished();
}
