package com.procureflow.shared.outbox;

import com.procureflow.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Outbox Relay: polls the outbox table and publishes to Kafka.
 *
 * Runs one second after the previous poll completes and processes up to
 * 50 records per poll. Failed records back off exponentially and are
 * abandoned after {@link OutboxRecord#MAX_RETRIES} attempts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxRelayService {

    private static final int BATCH_SIZE = 50;

    private final OutboxRepository outboxRepository;
    private final EventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private Counter relayedCounter;
    private Counter relayErrorCounter;

    @PostConstruct
    void initMetrics() {
        relayedCounter = Counter.builder("outbox.records.relayed")
                .description("Outbox records successfully relayed to Kafka")
                .register(meterRegistry);
        relayErrorCounter = Counter.builder("outbox.relay.errors")
                .description("Errors during outbox relay")
                .register(meterRegistry);
        Gauge.builder("outbox.records.pending", outboxRepository, OutboxRepository::countUnpublished)
                .description("Outbox records waiting to be relayed")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${outbox.relay.interval-ms:1000}")
    @Transactional
    public void relay() {
        Instant now = Instant.now();
        List<OutboxRecord> records = outboxRepository.findUnpublishedForRelay(now, BATCH_SIZE);

        if (records.isEmpty()) return;

        log.debug("Outbox relay: processing {} records", records.size());

        for (OutboxRecord record : records) {
            try {
                eventPublisher.publishRawAndWait(record.getTopic(), record.getPartitionKey(),
                        record.getId(), record.getEventType(), record.getPayload());
                record.markPublished(now);
                relayedCounter.increment();
            } catch (Exception ex) {
                log.error("Failed to relay outbox record: id={}, eventType={}, attempt={}",
                        record.getId(), record.getEventType(), record.getRetryCount() + 1, ex);
                record.recordFailure(ex.getMessage(), now);
                relayErrorCounter.increment();
                if (record.isExhausted()) {
                    log.error("Outbox record exhausted retries and will not be relayed: id={}, eventType={}",
                            record.getId(), record.getEventType());
                }
            }
        }

        outboxRepository.saveAll(records);
    }
}
