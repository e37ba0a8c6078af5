package com.procureflow.engine.order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.procureflow.engine.exception.InvalidTransitionException;
import com.procureflow.engine.routing.RoutingDecision;

import jakarta.persistence.CascadeType;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Purchase order aggregate. Owns its approval state; every budget movement is
 * delegated to the reservation manager and only referenced here by reservation id.
 *
 * State changes go through {@link #transitionTo}, which enforces {@link PurchaseOrderStatus}'s table.
 */
@Entity
@Table(name = "purchase_orders", indexes = {
    @Index(name = "idx_po_status", columnList = "status"),
    @Index(name = "idx_po_department", columnList = "department_id"),
    @Index(name = "idx_po_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseOrder {

    @Id
    @Column(name = "id", length = 50)
    private String id;

    @Column(name = "department_id", nullable = false, length = 50)
    private String departmentId;

    @Column(name = "supplier_id", nullable = false, length = 50)
    private String supplierId;

    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "requested_by", nullable = false, length = 100)
    private String requestedBy;

    @Column(name = "description", length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    @Setter(AccessLevel.NONE)
    private PurchaseOrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "routing_type", length = 30)
    private RoutingDecision.Type routingType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "po_required_roles", joinColumns = @JoinColumn(name = "po_id"))
    @OrderColumn(name = "role_order")
    @Column(name = "approver_role", nullable = false, length = 50)
    @Builder.Default
    private List<String> requiredRoles = new ArrayList<>();

    @Column(name = "matched_rule_id")
    private Long matchedRuleId;

    @Column(name = "escalated", nullable = false)
    private boolean escalated;

    @Column(name = "reservation_id")
    private Long reservationId;

    @Column(name = "decision_reason", length = 1000)
    private String decisionReason;

    @Column(name = "reservation_attempts", nullable = false)
    private int reservationAttempts;

    /** Set once the pending-budget retries are exhausted and a human has been alerted */
    @Column(name = "budget_escalated", nullable = false)
    private boolean budgetEscalated;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "po_id", nullable = false)
    @OrderBy("id ASC")
    @Builder.Default
    private List<ApprovalAction> actions = new ArrayList<>();

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public void transitionTo(PurchaseOrderStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, "transition to " + target.wireName());
        }
        status = target;
    }

    public void applyRouting(RoutingDecision decision) {
        routingType = decision.getType();
        requiredRoles.clear();
        requiredRoles.addAll(decision.getRequiredRoles());
        matchedRuleId = decision.getMatchedRuleId();
        escalated = decision.isEscalated();
        decisionReason = decision.getReason();
    }

    public boolean hasApproved(String role) {
        return actions.stream()
                .anyMatch(a -> a.getRole().equals(role) && a.getDecision() == ApprovalDecision.APPROVE);
    }

    public boolean isFullyApproved() {
        return !requiredRoles.isEmpty() && requiredRoles.stream().allMatch(this::hasApproved);
    }

    public List<String> pendingRoles() {
        return requiredRoles.stream().filter(r -> !hasApproved(r)).toList();
    }

    public void recordAction(String role, ApprovalDecision decision, String comment, Instant at) {
        actions.add(ApprovalAction.builder()
                .role(role)
                .decision(decision)
                .comment(comment)
                .actedAt(at)
                .build());
    }

    public int incrementReservationAttempts() {
        return ++reservationAttempts;
    }
}
