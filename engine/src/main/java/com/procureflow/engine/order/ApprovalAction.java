package com.procureflow.engine.order;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** One approver decision on a purchase order. Append-only. */
@Entity @Table(name = "approval_actions")
@Getter @Builder @NoArgsConstructor @AllArgsConstructor
public class ApprovalAction {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY) private Long id;
    @Column(name = "approver_role", nullable = false, length = 50) private String role;
    @Enumerated(EnumType.STRING) @Column(name = "decision", nullable = false, length = 10) private ApprovalDecision decision;
    @Column(name = "comment", length = 1000) private String comment;
    @Column(name = "acted_at", nullable = false) private Instant actedAt;
}
