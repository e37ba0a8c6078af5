package com.procureflow.engine.order;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Submit Purchase Order Command
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitPurchaseOrderCommand {
    private String departmentId;
    private String supplierId;
    private BigDecimal amount;
    private String requestedBy;
    private String description;
    private String poId; // Optional: caller-supplied id makes resubmission idempotent
}
