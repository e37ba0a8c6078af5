package com.procureflow.engine.order;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Purchase order lifecycle.
 *
 * <pre>
 * DRAFT ─► ROUTED ─┬─► BLOCKED
 *                  ├─► PENDING_BUDGET ─┬─► RESERVED
 *                  │                   ├─► BLOCKED
 *                  │                   └─► RELEASED
 *                  └─► RESERVED ─┬─► APPROVED ─► CONSUMED
 *                                └─► AWAITING_APPROVAL ─┬─► APPROVED
 *                                                       ├─► REJECTED ─► RELEASED
 *                                                       └─► RELEASED
 * </pre>
 */
public enum PurchaseOrderStatus {
    DRAFT,
    ROUTED,
    BLOCKED,
    PENDING_BUDGET,
    RESERVED,
    AWAITING_APPROVAL,
    APPROVED,
    REJECTED,
    CONSUMED,
    RELEASED;

    private static final Map<PurchaseOrderStatus, Set<PurchaseOrderStatus>> TRANSITIONS =
            new EnumMap<>(PurchaseOrderStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(ROUTED));
        TRANSITIONS.put(ROUTED, EnumSet.of(BLOCKED, RESERVED, PENDING_BUDGET));
        TRANSITIONS.put(PENDING_BUDGET, EnumSet.of(RESERVED, BLOCKED, RELEASED));
        TRANSITIONS.put(RESERVED, EnumSet.of(APPROVED, AWAITING_APPROVAL));
        TRANSITIONS.put(AWAITING_APPROVAL, EnumSet.of(APPROVED, REJECTED, RELEASED));
        TRANSITIONS.put(APPROVED, EnumSet.of(CONSUMED));
        TRANSITIONS.put(REJECTED, EnumSet.of(RELEASED));
        TRANSITIONS.put(BLOCKED, EnumSet.noneOf(PurchaseOrderStatus.class));
        TRANSITIONS.put(CONSUMED, EnumSet.noneOf(PurchaseOrderStatus.class));
        TRANSITIONS.put(RELEASED, EnumSet.noneOf(PurchaseOrderStatus.class));
    }

    public boolean canTransitionTo(PurchaseOrderStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<PurchaseOrderStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts {@code pending_budget}, {@code pending-budget} and {@code PENDING_BUDGET}. */
    @JsonCreator
    public static PurchaseOrderStatus fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("Status must not be null");
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown purchase order status: " + value, e);
        }
    }
}
