package com.procureflow.shared.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Platform-level Kafka Producer.
 *
 * Wraps Spring's KafkaTemplate with:
 *  - CloudEvent metadata propagated as Kafka headers
 *  - Publish rate, latency and error metrics
 *  - Structured logging with event metadata
 *
 * Domain code does not call this directly; it appends to the outbox and the
 * relay publishes the stored payload with {@link #publishRawAndWait}.
 */
@Slf4j
@Component
public class EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate, MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.publishSuccessCounter = Counter.builder("kafka.messages.published")
                .tag("status", "success")
                .description("Total Kafka messages published successfully")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("kafka.messages.published")
                .tag("status", "error")
                .description("Total Kafka message publish failures")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("kafka.publish.duration")
                .description("Time to publish a message to Kafka")
                .register(meterRegistry);
    }

    /**
     * Publish an already-serialized event payload. Used by the outbox relay so the
     * stored JSON goes out byte-for-byte, without a second serialization pass.
     */
    public CompletableFuture<SendResult<String, String>> publishRaw(String topic, String partitionKey,
                                                                  String eventId, String eventType,
                                                                  String payload) {
        Timer.Sample sample = Timer.start();

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, partitionKey, payload);
        record.headers()
                .add(new RecordHeader("event-type", eventType.getBytes(StandardCharsets.UTF_8)))
                .add(new RecordHeader("event-id", eventId.getBytes(StandardCharsets.UTF_8)));
        if (partitionKey != null) {
            record.headers().add(new RecordHeader("correlation-id", partitionKey.getBytes(StandardCharsets.UTF_8)));
        }

        return kafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    sample.stop(publishTimer);
                    if (ex == null) {
                        publishSuccessCounter.increment();
                        log.debug("Event published: topic={}, eventId={}, type={}, key={}, partition={}, offset={}",
                                topic, eventId, eventType, partitionKey,
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    } else {
                        publishErrorCounter.increment();
                        log.error("Failed to publish event: topic={}, eventId={}, type={}, error={}",
                                topic, eventId, eventType, ex.getMessage(), ex);
                    }
                });
    }

    /**
     * Synchronous raw publish; blocks until the broker acknowledges.
     */
    public void publishRawAndWait(String topic, String partitionKey, String eventId,
                                  String eventType, String payload) {
        try {
            publishRaw(topic, partitionKey, eventId, eventType, payload).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing event: " + eventType, e);
        } catch (Exception e) {
            throw new EventPublishException("Failed to publish event synchronously: " + eventType, e);
        }
    }

    public static class EventPublishException extends RuntimeException {
        public EventPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
