package com.procureflow.engine.exception;

import lombok.Getter;

/**
 * An action was attempted on a purchase order in a state that does not permit it.
 * The state is left unchanged.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String poId;
    private final String currentState;
    private final String attempted;

    public InvalidTransitionException(String poId, Enum<?> currentState, String attempted) {
        super(String.format("Invalid transition for %s: %s is not allowed from %s", poId, attempted, currentState));
        this.poId = poId;
        this.currentState = currentState.name();
        this.attempted = attempted;
    }
}
