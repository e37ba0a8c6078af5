package com.procureflow.engine.budget;

import lombok.Value;

/**
 * Outcome of release or consume. {@code ALREADY_TERMINAL} means the reservation had
 * already been settled and nothing changed; callers treat it as success.
 */
@Value
public class SettlementResult {

    public enum Outcome { RELEASED, CONSUMED, ALREADY_TERMINAL }

    Outcome outcome;
    Long reservationId;
    ReservationStatus finalStatus;

    public boolean changedBalances() {
        return outcome != Outcome.ALREADY_TERMINAL;
    }
}
