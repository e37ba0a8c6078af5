package com.procureflow.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Base CloudEvent (CloudEvents v1.0 attribute names).
 *
 * Every event carries:
 *  - id:            Globally unique event identifier (UUID v4)
 *  - type:          Dot-notation name, e.g. "po.approved"
 *  - source:        Originating component URI, e.g. "/services/po-engine"
 *  - time:          ISO 8601 timestamp of when the event occurred
 *  - correlationId: The purchase order id; ties every event of one PO together
 *  - causationId:   The event that caused this event, when there is one
 *  - version:       Schema version for forward compatibility
 */
@Getter
@ToString
public abstract class DomainEvent {

    private final String id;
    private final String type;
    private final String source;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant time;

    private final String correlationId;
    private final String causationId;
    private final int version;
    private final String specversion = "1.0";
    private final String datacontenttype = "application/json";

    protected DomainEvent(String type, String source, String correlationId, String causationId, int version) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.time = Instant.now();
        this.correlationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
        this.causationId = causationId;
        this.version = version;
    }

    protected DomainEvent(String type, String source, String correlationId) {
        this(type, source, correlationId, null, 1);
    }
}
