package com.procureflow.engine.exception;

/**
 * spent + reserved would exceed allocated, or a balance would go negative.
 * Never an expected runtime condition: the surrounding transaction is rolled back.
 */
public class BudgetInvariantViolationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BudgetInvariantViolationException(String departmentId, String detail) {
        super(String.format("Budget invariant violated for department %s: %s", departmentId, detail));
    }
}
