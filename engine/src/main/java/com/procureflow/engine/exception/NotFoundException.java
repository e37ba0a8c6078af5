package com.procureflow.engine.exception;

import lombok.Getter;

/**
 * A referenced supplier, budget, purchase order or reservation does not exist.
 * Caller error; surfaced as-is.
 */
@Getter
public class NotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, Object entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = String.valueOf(entityId);
    }
}
