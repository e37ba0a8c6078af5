package com.procureflow.engine.budget;

public enum ReservationStatus {
    ACTIVE,
    RELEASED,
    CONSUMED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
