package com.procureflow.engine.policy;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Result of a bracket lookup: either the matched rule, or a request for manual
 * escalation when the amount is above every effective bracket.
 */
@Getter
public final class RuleLookup {

    private final ApprovalRule rule;
    private final BigDecimal amount;

    private RuleLookup(ApprovalRule rule, BigDecimal amount) {
        this.rule = rule;
        this.amount = amount;
    }

    public static RuleLookup matched(ApprovalRule rule, BigDecimal amount) {
        return new RuleLookup(rule, amount);
    }

    public static RuleLookup requiresEscalation(BigDecimal amount) {
        return new RuleLookup(null, amount);
    }

    public boolean isMatched() {
        return rule != null;
    }

    public boolean requiresManualEscalation() {
        return rule == null;
    }
}
