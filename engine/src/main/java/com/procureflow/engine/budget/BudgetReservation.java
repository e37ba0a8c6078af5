package com.procureflow.engine.budget;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity @Table(name = "budget_reservations", indexes = {
        @Index(name = "idx_reservation_po", columnList = "po_id"),
        @Index(name = "idx_reservation_budget", columnList = "budget_id")
})
@Getter @Setter @Builder @NoArgsConstructor @AllArgsConstructor
public class BudgetReservation {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY) private Long id;
    @Column(name = "po_id", nullable = false, length = 50) private String poId;
    @Column(name = "budget_id", nullable = false) private Long budgetId;
    @Column(name = "department_id", nullable = false, length = 50) private String departmentId;
    @Column(name = "amount", nullable = false, precision = 15, scale = 2) private BigDecimal amount;
    @Enumerated(EnumType.STRING) @Column(name = "status", nullable = false, length = 20) private ReservationStatus status;
    @Column(name = "created_at", updatable = false) private Instant createdAt;
    /** Set once, when the reservation is released or consumed */
    @Column(name = "settled_at") private Instant settledAt;
    @Version @Column(name = "version", nullable = false) private long version;

    @PrePersist void prePersist() { if (createdAt == null) createdAt = Instant.now(); }

    public boolean isActive() { return status == ReservationStatus.ACTIVE; }

    public void settle(ReservationStatus terminal, Instant at) {
        status = terminal;
        settledAt = at;
    }
}
