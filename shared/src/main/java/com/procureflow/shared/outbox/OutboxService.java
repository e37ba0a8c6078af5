package com.procureflow.shared.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureflow.shared.events.DomainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Outbox Append Service
 *
 * Called from inside a domain service's {@literal @}Transactional method to write an
 * outbox record in the same transaction as the state change it describes.
 *
 * <pre>
 * {@literal @}Transactional
 * public ReservationResult reserve(...) {
 *     budget.reserve(amount);                              // domain write
 *     outboxService.append(poId, "BudgetReservation",      // event record (same tx)
 *         EventTypes.TOPIC_BUDGET_RESERVED, event);
 * }
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    /**
     * Append an event to the outbox within the current transaction.
     *
     * @param aggregateId   Domain aggregate ID (e.g. the PO id)
     * @param aggregateType Domain aggregate type (e.g. "PurchaseOrder")
     * @param topic         Kafka topic to publish to
     * @param event         The domain event to publish
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void append(String aggregateId, String aggregateType, String topic, DomainEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event to JSON: " + event.getType(), e);
        }

        OutboxRecord record = OutboxRecord.builder()
                .id(event.getId())
                .aggregateId(aggregateId)
                .aggregateType(aggregateType)
                .eventType(event.getType())
                .topic(topic)
                .partitionKey(event.getCorrelationId())
                .payload(payload)
                .retryCount(0)
                .build();

        outboxRepository.save(record);

        log.debug("Outbox record appended: eventId={}, type={}, aggregateId={}",
                event.getId(), event.getType(), aggregateId);
    }
}
