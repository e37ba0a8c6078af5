package com.procureflow.shared.outbox;

import com.procureflow.shared.kafka.EventPublisher;
import com.procureflow.shared.kafka.EventPublisher.EventPublishException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxRelayServiceTest {

    @Mock OutboxRepository outboxRepository;
    @Mock EventPublisher eventPublisher;

    SimpleMeterRegistry meterRegistry;
    OutboxRelayService relay;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        relay = new OutboxRelayService(outboxRepository, eventPublisher, meterRegistry);
        relay.initMetrics();
    }

    private OutboxRecord record(String id) {
        return OutboxRecord.builder()
                .id(id)
                .aggregateId("PO-1")
                .aggregateType("PurchaseOrder")
                .eventType("po.approved")
                .topic("po.approved")
                .partitionKey("PO-1")
                .payload("{\"poId\":\"PO-1\"}")
                .build();
    }

    @Test
    @DisplayName("Published records are marked and saved")
    void relay_marksPublished() {
        OutboxRecord record = record("evt-1");
        when(outboxRepository.findUnpublishedForRelay(any(), anyInt())).thenReturn(List.of(record));

        relay.relay();

        verify(eventPublisher).publishRawAndWait("po.approved", "PO-1", "evt-1", "po.approved", "{\"poId\":\"PO-1\"}");
        verify(outboxRepository).saveAll(List.of(record));
        assertThat(record.isPublished()).isTrue();
        assertThat(meterRegistry.counter("outbox.records.relayed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A failed publish schedules a retry and does not stop the batch")
    void relay_failureIsRecordedPerRecord() {
        OutboxRecord failing = record("evt-1");
        OutboxRecord ok = record("evt-2");
        when(outboxRepository.findUnpublishedForRelay(any(), anyInt())).thenReturn(List.of(failing, ok));
        doAnswer(invocation -> {
            if ("evt-1".equals(invocation.getArgument(2))) {
                throw new EventPublishException("broker unavailable", new RuntimeException());
            }
            return null;
        }).when(eventPublisher).publishRawAndWait(any(), any(), any(), any(), any());

        relay.relay();

        assertThat(failing.isPublished()).isFalse();
        assertThat(failing.getRetryCount()).isEqualTo(1);
        assertThat(failing.getNextRetryAt()).isNotNull();
        assertThat(failing.getLastError()).contains("broker unavailable");
        assertThat(ok.isPublished()).isTrue();
        assertThat(meterRegistry.counter("outbox.relay.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("An empty poll publishes nothing")
    void relay_emptyBatch() {
        when(outboxRepository.findUnpublishedForRelay(any(), anyInt())).thenReturn(List.of());

        relay.relay();

        verifyNoInteractions(eventPublisher);
        verify(outboxRepository, never()).saveAll(any());
    }
}
