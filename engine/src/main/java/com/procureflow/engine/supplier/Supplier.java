package com.procureflow.engine.supplier;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity @Table(name = "suppliers")
@Getter @Setter @Builder @NoArgsConstructor @AllArgsConstructor
public class Supplier {
    @Id @Column(name = "supplier_id", length = 50) private String supplierId;
    @Column(name = "name", nullable = false) private String name;
    @Enumerated(EnumType.STRING) @Column(name = "status", nullable = false, length = 20) private SupplierStatus status;
    @Column(name = "rating", precision = 3, scale = 2) private BigDecimal rating;
    @Column(name = "payment_terms", length = 50) private String paymentTerms;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "supplier_categories", joinColumns = @JoinColumn(name = "supplier_id"))
    @Column(name = "category", length = 100)
    @Builder.Default
    private Set<String> categories = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING) @Column(name = "risk_score", nullable = false, length = 10) private RiskScore riskScore;
    @Column(name = "max_order_value", nullable = false, precision = 15, scale = 2) private BigDecimal maxOrderValue;
    @Column(name = "contact_email") private String contactEmail;

    @Column(name = "created_at", updatable = false) private Instant createdAt;
    @Column(name = "updated_at") private Instant updatedAt;
    @PrePersist void onCreate() { Instant now = Instant.now(); if (createdAt == null) createdAt = now; updatedAt = now; }
    @PreUpdate void onUpdate() { updatedAt = Instant.now(); }

    public boolean isSuspended() { return status == SupplierStatus.SUSPENDED; }
    public boolean isApproved() { return status == SupplierStatus.APPROVED; }
    public boolean isHighRisk() { return riskScore == RiskScore.HIGH; }

    public boolean exceedsMaxOrderValue(BigDecimal amount) {
        return maxOrderValue != null && amount.compareTo(maxOrderValue) > 0;
    }
}
