package com.procureflow.engine.supplier;

public enum SupplierStatus {
    APPROVED,
    PENDING,
    /** Blocks every new purchase order regardless of amount */
    SUSPENDED
}
