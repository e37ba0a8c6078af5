package com.procureflow.engine.order;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalDecision {
    APPROVE,
    REJECT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ApprovalDecision fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("Decision must not be null");
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "approve":
            case "approved":
                return APPROVE;
            case "reject":
            case "rejected":
                return REJECT;
            default:
                throw new IllegalArgumentException("Unknown approval decision: " + value);
        }
    }
}
