package com.procureflow.engine.consumer;

import java.nio.charset.StandardCharsets;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureflow.engine.exception.IneligibleApproverException;
import com.procureflow.engine.exception.InvalidTransitionException;
import com.procureflow.engine.exception.NotFoundException;
import com.procureflow.engine.order.ApprovalOrchestrator;
import com.procureflow.engine.order.PurchaseOrderView;
import com.procureflow.shared.events.EventTypes;
import com.procureflow.shared.kafka.IdempotencyService;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Approver Action Consumer
 *
 * Feeds approver decisions arriving on Kafka into the orchestrator.
 *
 * - Idempotency check FIRST: a redelivered message with a known event id is skipped
 * - Business rejections (unknown PO, wrong state, ineligible role) are logged and acknowledged;
 *   redelivering them would only produce the same answer
 * - Any other failure drops the idempotency claim and rethrows, so the container's error
 *   handler retries and finally routes the record to the DLQ
 *
 * Manual acknowledgment (AckMode.MANUAL_IMMEDIATE): offsets commit only after the
 * orchestrator's transaction has committed.
 */
@Slf4j
@Component
public class ApprovalActionConsumer {

    private final ApprovalOrchestrator orchestrator;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;
    private final Counter rejectedMessages;

    public ApprovalActionConsumer(ApprovalOrchestrator orchestrator,
                                  IdempotencyService idempotencyService,
                                  ObjectMapper objectMapper,
                                  MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;
        this.idempotencyService = idempotencyService;
        this.objectMapper = objectMapper;
        this.rejectedMessages = Counter.builder("approvals.actions.rejected").register(meterRegistry);
    }

    @KafkaListener(
            topics = EventTypes.TOPIC_APPROVAL_ACTIONS,
            groupId = "${engine.kafka.group-id:po-engine}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onApprovalAction(ConsumerRecord<String, String> record, Acknowledgment ack) throws Exception {
        ApprovalActionMessage message = objectMapper.readValue(record.value(), ApprovalActionMessage.class);

        String eventId = extractHeader(record, "event-id");
        if (eventId == null) eventId = message.getId();
        if (eventId == null) {
            log.warn("Approval action without event id skipped: topic={}, partition={}, offset={}",
                    record.topic(), record.partition(), record.offset());
            ack.acknowledge();
            return;
        }

        if (message.getPoId() == null || message.getRole() == null || message.getDecision() == null) {
            rejectedMessages.increment();
            log.warn("Incomplete approval action skipped: eventId={}, poId={}, role={}, decision={}",
                    eventId, message.getPoId(), message.getRole(), message.getDecision());
            ack.acknowledge();
            return;
        }

        if (idempotencyService.isDuplicate(eventId, EventTypes.TOPIC_APPROVAL_ACTIONS)) {
            ack.acknowledge();
            return;
        }

        try {
            PurchaseOrderView view = orchestrator.recordAction(
                    message.getPoId(), message.getRole(), message.getDecision(), message.getComment());
            log.info("Approval action applied: eventId={}, poId={}, role={}, decision={}, status={}",
                    eventId, message.getPoId(), message.getRole(), message.getDecision(), view.getStatus());
        } catch (NotFoundException | InvalidTransitionException | IneligibleApproverException e) {
            rejectedMessages.increment();
            log.warn("Approval action rejected: eventId={}, poId={}, role={}, reason={}",
                    eventId, message.getPoId(), message.getRole(), e.getMessage());
        } catch (RuntimeException e) {
            idempotencyService.release(eventId, EventTypes.TOPIC_APPROVAL_ACTIONS);
            log.error("Failed to process approval action: eventId={}, poId={}, error={}",
                    eventId, message.getPoId(), e.getMessage(), e);
            throw e;
        }
        ack.acknowledge();
    }

    private static String extractHeader(ConsumerRecord<?, ?> record, String headerName) {
        Header header = record.headers().lastHeader(headerName);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }
}
