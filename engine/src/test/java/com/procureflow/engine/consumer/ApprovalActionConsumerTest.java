package com.procureflow.engine.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.procureflow.engine.exception.InvalidTransitionException;
import com.procureflow.engine.order.ApprovalDecision;
import com.procureflow.engine.order.ApprovalOrchestrator;
import com.procureflow.engine.order.PurchaseOrderStatus;
import com.procureflow.engine.order.PurchaseOrderView;
import com.procureflow.shared.events.EventTypes;
import com.procureflow.shared.kafka.IdempotencyService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApprovalActionConsumerTest {

    @Mock ApprovalOrchestrator orchestrator;
    @Mock IdempotencyService idempotencyService;
    @Mock Acknowledgment ack;

    SimpleMeterRegistry meterRegistry;
    ApprovalActionConsumer consumer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        consumer = new ApprovalActionConsumer(orchestrator, idempotencyService, new ObjectMapper(), meterRegistry);
    }

    private ConsumerRecord<String, String> record(String json, String eventIdHeader) {
        ConsumerRecord<String, String> record =
                new ConsumerRecord<>(EventTypes.TOPIC_APPROVAL_ACTIONS, 0, 7L, "PO-1", json);
        if (eventIdHeader != null) {
            record.headers().add(new RecordHeader("event-id", eventIdHeader.getBytes(StandardCharsets.UTF_8)));
        }
        return record;
    }

    private static final String APPROVE_JSON =
            "{\"poId\":\"PO-1\",\"role\":\"manager\",\"decision\":\"approve\",\"comment\":\"ok\"}";

    @Test
    @DisplayName("Approval action is applied and acknowledged")
    void appliesAction() throws Exception {
        when(idempotencyService.isDuplicate("evt-1", EventTypes.TOPIC_APPROVAL_ACTIONS)).thenReturn(false);
        when(orchestrator.recordAction("PO-1", "manager", ApprovalDecision.APPROVE, "ok"))
                .thenReturn(PurchaseOrderView.builder().poId("PO-1").status(PurchaseOrderStatus.APPROVED).build());

        consumer.onApprovalAction(record(APPROVE_JSON, "evt-1"), ack);

        verify(orchestrator).recordAction("PO-1", "manager", ApprovalDecision.APPROVE, "ok");
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Payload id is used when the event-id header is missing")
    void fallsBackToPayloadId() throws Exception {
        String json = "{\"id\":\"msg-9\",\"poId\":\"PO-1\",\"role\":\"manager\",\"decision\":\"rejected\"}";
        when(idempotencyService.isDuplicate("msg-9", EventTypes.TOPIC_APPROVAL_ACTIONS)).thenReturn(false);
        when(orchestrator.recordAction("PO-1", "manager", ApprovalDecision.REJECT, null))
                .thenReturn(PurchaseOrderView.builder().poId("PO-1").status(PurchaseOrderStatus.REJECTED).build());

        consumer.onApprovalAction(record(json, null), ack);

        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Duplicate delivery is acknowledged without reprocessing")
    void duplicateIsSkipped() throws Exception {
        when(idempotencyService.isDuplicate("evt-1", EventTypes.TOPIC_APPROVAL_ACTIONS)).thenReturn(true);

        consumer.onApprovalAction(record(APPROVE_JSON, "evt-1"), ack);

        verifyNoInteractions(orchestrator);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Incomplete action is counted as rejected and acknowledged")
    void incompleteMessageIsSkipped() throws Exception {
        consumer.onApprovalAction(record("{\"poId\":\"PO-1\",\"decision\":\"approve\"}", "evt-2"), ack);

        verifyNoInteractions(orchestrator, idempotencyService);
        verify(ack).acknowledge();
        assertThat(meterRegistry.counter("approvals.actions.rejected").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Action on a PO in the wrong state is acknowledged, not retried")
    void businessRejectionIsAcknowledged() throws Exception {
        when(idempotencyService.isDuplicate(anyString(), anyString())).thenReturn(false);
        when(orchestrator.recordAction(any(), any(), any(), any()))
                .thenThrow(new InvalidTransitionException("PO-1", PurchaseOrderStatus.APPROVED, "approve"));

        consumer.onApprovalAction(record(APPROVE_JSON, "evt-3"), ack);

        verify(ack).acknowledge();
        verify(idempotencyService, never()).release(anyString(), anyString());
        assertThat(meterRegistry.counter("approvals.actions.rejected").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Unexpected failure releases the claim and rethrows without acknowledging")
    void infrastructureFailureIsRethrown() {
        when(idempotencyService.isDuplicate(anyString(), anyString())).thenReturn(false);
        when(orchestrator.recordAction(any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("database unavailable"));

        assertThatThrownBy(() -> consumer.onApprovalAction(record(APPROVE_JSON, "evt-4"), ack))
                .isInstanceOf(IllegalStateException.class);

        verify(idempotencyService).release("evt-4", EventTypes.TOPIC_APPROVAL_ACTIONS);
        verify(ack, never()).acknowledge();
    }
}
