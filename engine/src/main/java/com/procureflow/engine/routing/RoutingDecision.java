package com.procureflow.engine.routing;

import java.util.List;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Where a purchase order goes next. Always carries a human-readable reason.
 * Equal inputs produce equal decisions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutingDecision {

    public enum Type { AUTO_APPROVED, REQUIRES_APPROVAL, BLOCKED }

    Type type;
    /** Ordered, duplicate-free. Empty unless REQUIRES_APPROVAL. */
    List<String> requiredRoles;
    Long matchedRuleId;
    boolean escalated;
    String reason;

    public static RoutingDecision autoApproved(Long ruleId, String reason) {
        return new RoutingDecision(Type.AUTO_APPROVED, List.of(), ruleId, false, reason);
    }

    public static RoutingDecision requires(List<String> roles, Long ruleId, boolean escalated, String reason) {
        return new RoutingDecision(Type.REQUIRES_APPROVAL, List.copyOf(roles), ruleId, escalated, reason);
    }

    public static RoutingDecision blocked(String reason) {
        return new RoutingDecision(Type.BLOCKED, List.of(), null, false, reason);
    }

    public boolean isBlocked() { return type == Type.BLOCKED; }
    public boolean isAutoApproved() { return type == Type.AUTO_APPROVED; }
}
