package com.procureflow.shared.events;

/**
 * Canonical event type constants.
 * All components MUST use these constants, never hardcode strings.
 * Changing a type here is a breaking change requiring consumer updates.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Purchase Order Domain ─────────────────────────────────────────────────
    public static final String PO_SUBMITTED          = "po.submitted";
    public static final String PO_BLOCKED            = "po.blocked";
    public static final String PO_PENDING_BUDGET     = "po.pending-budget";
    public static final String PO_APPROVAL_REQUESTED = "po.approval-requested";
    public static final String PO_APPROVED           = "po.approved";
    public static final String PO_REJECTED           = "po.rejected";
    public static final String PO_CANCELLED          = "po.cancelled";
    public static final String PO_BUDGET_ESCALATED   = "po.budget-escalated";

    // ── Budget Domain ─────────────────────────────────────────────────────────
    public static final String BUDGET_RESERVED = "budget.reserved";
    public static final String BUDGET_RELEASED = "budget.released";
    public static final String BUDGET_CONSUMED = "budget.consumed";

    // ── Kafka Topics (same as event types for simplicity) ─────────────────────
    public static final String TOPIC_PO_SUBMITTED          = PO_SUBMITTED;
    public static final String TOPIC_PO_BLOCKED            = PO_BLOCKED;
    public static final String TOPIC_PO_PENDING_BUDGET     = PO_PENDING_BUDGET;
    public static final String TOPIC_PO_APPROVAL_REQUESTED = PO_APPROVAL_REQUESTED;
    public static final String TOPIC_PO_APPROVED           = PO_APPROVED;
    public static final String TOPIC_PO_REJECTED           = PO_REJECTED;
    public static final String TOPIC_PO_CANCELLED          = PO_CANCELLED;
    public static final String TOPIC_PO_BUDGET_ESCALATED   = PO_BUDGET_ESCALATED;
    public static final String TOPIC_BUDGET_RESERVED       = BUDGET_RESERVED;
    public static final String TOPIC_BUDGET_RELEASED       = BUDGET_RELEASED;
    public static final String TOPIC_BUDGET_CONSUMED       = BUDGET_CONSUMED;
    public static final String TOPIC_APPROVAL_ACTIONS      = "approvals.actions";
    public static final String TOPIC_DLQ_APPROVAL_ACTIONS  = "dlq.approvals.actions";
}
