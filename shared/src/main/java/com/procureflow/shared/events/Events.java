package com.procureflow.shared.events;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * All domain event payload classes.
 * Each event extends DomainEvent and adds its specific payload.
 *
 * Naming: {Noun}{PastTense}Event, e.g. PurchaseOrderApprovedEvent, BudgetReservedEvent
 */
public final class Events {

    private static final String SOURCE = "/services/po-engine";

    private Events() {}

    // ─── Purchase Order Events ─────────────────────────────────────────────────

    @Getter
    public static class PurchaseOrderSubmittedEvent extends DomainEvent {
        private final String poId;
        private final String departmentId;
        private final String supplierId;
        private final BigDecimal amount;
        private final String requestedBy;

        public PurchaseOrderSubmittedEvent(String poId, String departmentId, String supplierId,
                                           BigDecimal amount, String requestedBy) {
            super(EventTypes.PO_SUBMITTED, SOURCE, poId);
            this.poId = poId;
            this.departmentId = departmentId;
            this.supplierId = supplierId;
            this.amount = amount;
            this.requestedBy = requestedBy;
        }
    }

    @Getter
    public static class PurchaseOrderBlockedEvent extends DomainEvent {
        private final String poId;
        private final String supplierId;
        private final String reason;

        public PurchaseOrderBlockedEvent(String poId, String supplierId, String reason) {
            super(EventTypes.PO_BLOCKED, SOURCE, poId);
            this.poId = poId;
            this.supplierId = supplierId;
            this.reason = reason;
        }
    }

    @Getter
    public static class PurchaseOrderPendingBudgetEvent extends DomainEvent {
        private final String poId;
        private final String departmentId;
        private final BigDecimal requested;
        private final BigDecimal available;
        private final int attempts;

        public PurchaseOrderPendingBudgetEvent(String poId, String departmentId, BigDecimal requested,
                                               BigDecimal available, int attempts) {
            super(EventTypes.PO_PENDING_BUDGET, SOURCE, poId);
            this.poId = poId;
            this.departmentId = departmentId;
            this.requested = requested;
            this.available = available;
            this.attempts = attempts;
        }
    }

    @Getter
    public static class ApprovalRequestedEvent extends DomainEvent {
        private final String poId;
        private final BigDecimal amount;
        private final List<ApproverContact> approvers;
        private final boolean escalated;

        public ApprovalRequestedEvent(String poId, BigDecimal amount, List<ApproverContact> approvers,
                                      boolean escalated) {
            super(EventTypes.PO_APPROVAL_REQUESTED, SOURCE, poId);
            this.poId = poId;
            this.amount = amount;
            this.approvers = approvers;
            this.escalated = escalated;
        }
    }

    @Getter
    public static class PurchaseOrderApprovedEvent extends DomainEvent {
        private final String poId;
        private final String departmentId;
        private final BigDecimal amount;
        private final boolean autoApproved;

        public PurchaseOrderApprovedEvent(String poId, String departmentId, BigDecimal amount,
                                          boolean autoApproved) {
            super(EventTypes.PO_APPROVED, SOURCE, poId);
            this.poId = poId;
            this.departmentId = departmentId;
            this.amount = amount;
            this.autoApproved = autoApproved;
        }
    }

    @Getter
    public static class PurchaseOrderRejectedEvent extends DomainEvent {
        private final String poId;
        private final String rejectedBy;
        private final String reason;

        public PurchaseOrderRejectedEvent(String poId, String rejectedBy, String reason) {
            super(EventTypes.PO_REJECTED, SOURCE, poId);
            this.poId = poId;
            this.rejectedBy = rejectedBy;
            this.reason = reason;
        }
    }

    @Getter
    public static class PurchaseOrderCancelledEvent extends DomainEvent {
        private final String poId;
        private final String reason;
        private final boolean reservationReleased;

        public PurchaseOrderCancelledEvent(String poId, String reason, boolean reservationReleased) {
            super(EventTypes.PO_CANCELLED, SOURCE, poId);
            this.poId = poId;
            this.reason = reason;
            this.reservationReleased = reservationReleased;
        }
    }

    @Getter
    public static class BudgetEscalatedEvent extends DomainEvent {
        private final String poId;
        private final String departmentId;
        private final BigDecimal amount;
        private final int attempts;

        public BudgetEscalatedEvent(String poId, String departmentId, BigDecimal amount, int attempts) {
            super(EventTypes.PO_BUDGET_ESCALATED, SOURCE, poId);
            this.poId = poId;
            this.departmentId = departmentId;
            this.amount = amount;
            this.attempts = attempts;
        }
    }

    // ─── Budget Events ─────────────────────────────────────────────────────────

    @Getter
    public static class BudgetReservedEvent extends DomainEvent {
        private final Long reservationId;
        private final String poId;
        private final String departmentId;
        private final BigDecimal amount;
        private final BigDecimal availableAfter;

        public BudgetReservedEvent(Long reservationId, String poId, String departmentId,
                                   BigDecimal amount, BigDecimal availableAfter) {
            super(EventTypes.BUDGET_RESERVED, SOURCE, poId);
            this.reservationId = reservationId;
            this.poId = poId;
            this.departmentId = departmentId;
            this.amount = amount;
            this.availableAfter = availableAfter;
        }
    }

    @Getter
    public static class BudgetReleasedEvent extends DomainEvent {
        private final Long reservationId;
        private final String poId;
        private final String departmentId;
        private final BigDecimal amount;

        public BudgetReleasedEvent(Long reservationId, String poId, String departmentId, BigDecimal amount) {
            super(EventTypes.BUDGET_RELEASED, SOURCE, poId);
            this.reservationId = reservationId;
            this.poId = poId;
            this.departmentId = departmentId;
            this.amount = amount;
        }
    }

    @Getter
    public static class BudgetConsumedEvent extends DomainEvent {
        private final Long reservationId;
        private final String poId;
        private final String departmentId;
        private final BigDecimal amount;

        public BudgetConsumedEvent(Long reservationId, String poId, String departmentId, BigDecimal amount) {
            super(EventTypes.BUDGET_CONSUMED, SOURCE, poId);
            this.reservationId = reservationId;
            this.poId = poId;
            this.departmentId = departmentId;
            this.amount = amount;
        }
    }

    // ─── Value Objects ─────────────────────────────────────────────────────────

    @Getter
    public static class ApproverContact {
        private final String role;
        private final String name;
        private final String email;

        public ApproverContact(String role, String name, String email) {
            this.role = role;
            this.name = name;
            this.email = email;
        }
    }
}
