package com.procureflow.engine.exception;

import lombok.Getter;

/**
 * The acting role is not currently required for the purchase order, or its approver is inactive.
 */
@Getter
public class IneligibleApproverException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String poId;
    private final String role;

    public IneligibleApproverException(String poId, String role, String reason) {
        super(String.format("Role %s cannot act on %s: %s", role, poId, reason));
        this.poId = poId;
        this.role = role;
    }
}
