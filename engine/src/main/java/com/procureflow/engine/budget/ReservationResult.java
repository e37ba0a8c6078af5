package com.procureflow.engine.budget;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a reservation attempt. Running out of budget is an expected result, not an error.
 */
@Value
@Builder
public class ReservationResult {

    public enum Outcome { RESERVED, INSUFFICIENT_BUDGET }

    Outcome outcome;
    /** Present only when RESERVED */
    BudgetReservation reservation;
    BigDecimal requested;
    /** Headroom after a successful reservation, or the shortfall context when insufficient */
    BigDecimal available;

    public static ReservationResult reserved(BudgetReservation reservation, BigDecimal availableAfter) {
        return ReservationResult.builder()
                .outcome(Outcome.RESERVED)
                .reservation(reservation)
                .requested(reservation.getAmount())
                .available(availableAfter)
                .build();
    }

    public static ReservationResult insufficient(BigDecimal requested, BigDecimal available) {
        return ReservationResult.builder()
                .outcome(Outcome.INSUFFICIENT_BUDGET)
                .requested(requested)
                .available(available)
                .build();
    }

    public boolean isReserved() {
        return outcome == Outcome.RESERVED;
    }
}
