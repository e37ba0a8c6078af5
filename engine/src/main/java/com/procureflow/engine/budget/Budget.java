package com.procureflow.engine.budget;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

import com.procureflow.engine.exception.BudgetInvariantViolationException;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A department's allocation for one fiscal year.
 *
 * Invariant: {@code spent + reserved <= allocated}, all three non-negative.
 * Every mutator re-checks it and throws {@link BudgetInvariantViolationException} on breach,
 * which rolls back the surrounding transaction.
 */
@Entity
@Table(name = "budgets", uniqueConstraints = @UniqueConstraint(
        name = "uk_budget_department_year", columnNames = {"department_id", "fiscal_year"}))
@Getter @Setter @Builder @NoArgsConstructor @AllArgsConstructor
public class Budget {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY) private Long id;
    @Column(name = "department_id", nullable = false, length = 50) private String departmentId;
    @Column(name = "department_name") private String departmentName;
    @Column(name = "allocated", nullable = false, precision = 15, scale = 2) private BigDecimal allocated;
    @Column(name = "spent", nullable = false, precision = 15, scale = 2) @Builder.Default private BigDecimal spent = BigDecimal.ZERO;
    @Column(name = "reserved", nullable = false, precision = 15, scale = 2) @Builder.Default private BigDecimal reserved = BigDecimal.ZERO;
    @Column(name = "fiscal_year", nullable = false) private int fiscalYear;
    @Column(name = "manager_email") private String managerEmail;

    /** Second line of defence behind the pessimistic row lock */
    @Version @Column(name = "version", nullable = false) private long version;

    @Column(name = "updated_at") private Instant updatedAt;
    @PrePersist @PreUpdate void onUpdate() { updatedAt = Instant.now(); }

    public BigDecimal available() {
        return allocated.subtract(spent).subtract(reserved);
    }

    public boolean hasAvailable(BigDecimal amount) {
        return available().compareTo(amount) >= 0;
    }

    public void reserve(BigDecimal amount) {
        reserved = reserved.add(amount);
        verify("reserve " + amount);
    }

    public void release(BigDecimal amount) {
        reserved = reserved.subtract(amount);
        verify("release " + amount);
    }

    /** Moves an amount from reserved to spent. */
    public void consume(BigDecimal amount) {
        reserved = reserved.subtract(amount);
        spent = spent.add(amount);
        verify("consume " + amount);
    }

    public BigDecimal utilizationPercent() {
        if (allocated.signum() == 0) return BigDecimal.ZERO.setScale(2);
        return spent.multiply(HUNDRED).divide(allocated, 2, RoundingMode.HALF_UP);
    }

    private void verify(String operation) {
        if (spent.signum() < 0 || reserved.signum() < 0) {
            throw new BudgetInvariantViolationException(departmentId,
                    String.format("%s left spent=%s reserved=%s", operation, spent, reserved));
        }
        if (spent.add(reserved).compareTo(allocated) > 0) {
            throw new BudgetInvariantViolationException(departmentId,
                    String.format("%s left spent=%s + reserved=%s > allocated=%s", operation, spent, reserved, allocated));
        }
    }
}
