package com.procureflow.engine.policy;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One amount bracket of the approval matrix.
 * A PO whose amount is at most {@code maxAmount} is governed by the tightest such bracket.
 */
@Entity
@Table(name = "approval_matrix", indexes = {
    @Index(name = "idx_approval_matrix_amount", columnList = "max_amount")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "max_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal maxAmount;

    /** Roles in the order the matrix lists them */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "approval_matrix_approvers", joinColumns = @JoinColumn(name = "rule_id"))
    @OrderColumn(name = "approver_order")
    @Column(name = "approver_role", nullable = false, length = 50)
    @Builder.Default
    private List<String> requiredApprovers = new ArrayList<>();

    @Column(name = "auto_approve", nullable = false)
    private boolean autoApprove;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    /** NULL means the rule never expires */
    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean isEffectiveAt(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }
}
