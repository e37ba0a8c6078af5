package com.procureflow.engine.order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.procureflow.engine.routing.RoutingDecision;

import lombok.Builder;
import lombok.Value;

/**
 * Detached snapshot of a purchase order. Built inside the transaction that loaded it.
 */
@Value
@Builder
public class PurchaseOrderView {
    String poId;
    String departmentId;
    String supplierId;
    BigDecimal amount;
    String requestedBy;
    String description;
    PurchaseOrderStatus status;
    RoutingDecision.Type routingType;
    List<String> requiredRoles;
    List<String> pendingRoles;
    Long matchedRuleId;
    boolean escalated;
    Long reservationId;
    String decisionReason;
    int reservationAttempts;
    boolean budgetEscalated;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;

    static PurchaseOrderView of(PurchaseOrder po) {
        return PurchaseOrderView.builder()
                .poId(po.getId())
                .departmentId(po.getDepartmentId())
                .supplierId(po.getSupplierId())
                .amount(po.getAmount())
                .requestedBy(po.getRequestedBy())
                .description(po.getDescription())
                .status(po.getStatus())
                .routingType(po.getRoutingType())
                .requiredRoles(List.copyOf(po.getRequiredRoles()))
                .pendingRoles(po.getStatus() == PurchaseOrderStatus.AWAITING_APPROVAL ? po.pendingRoles() : List.of())
                .matchedRuleId(po.getMatchedRuleId())
                .escalated(po.isEscalated())
                .reservationId(po.getReservationId())
                .decisionReason(po.getDecisionReason())
                .reservationAttempts(po.getReservationAttempts())
                .budgetEscalated(po.isBudgetEscalated())
                .createdAt(po.getCreatedAt())
                .updatedAt(po.getUpdatedAt())
                .completedAt(po.getCompletedAt())
                .build();
    }
}
