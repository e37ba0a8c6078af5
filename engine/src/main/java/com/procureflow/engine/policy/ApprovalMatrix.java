package com.procureflow.engine.policy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of the effective approval brackets, sorted for binary search.
 *
 * Order: max_amount ascending, then larger approver set first (distinct roles), then lowest rule id.
 * The first entry whose max_amount is at least the PO amount is therefore the
 * tightest bracket, with ties already resolved towards the more conservative rule.
 */
public final class ApprovalMatrix {

    static final Comparator<ApprovalRule> BRACKET_ORDER = Comparator
            .comparing(ApprovalRule::getMaxAmount)
            .thenComparing(ApprovalMatrix::distinctApproverCount, Comparator.reverseOrder())
            .thenComparing(ApprovalRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<ApprovalRule> brackets;

    private ApprovalMatrix(List<ApprovalRule> brackets) {
        this.brackets = brackets;
    }

    /** Keeps only the rules effective at {@code now}. */
    public static ApprovalMatrix of(Collection<ApprovalRule> rules, Instant now) {
        return new ApprovalMatrix(rules.stream()
                .filter(r -> r.isEffectiveAt(now))
                .sorted(BRACKET_ORDER)
                .toList());
    }

    /**
     * Tightest bracket covering {@code amount}, or empty when the amount exceeds every bracket.
     */
    public Optional<ApprovalRule> tightestFor(BigDecimal amount) {
        int lo = 0;
        int hi = brackets.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (brackets.get(mid).getMaxAmount().compareTo(amount) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo < brackets.size() ? Optional.of(brackets.get(lo)) : Optional.empty();
    }

    public List<ApprovalRule> brackets() {
        return brackets;
    }

    public boolean isEmpty() {
        return brackets.isEmpty();
    }

    private static int distinctApproverCount(ApprovalRule rule) {
        return new LinkedHashSet<>(rule.getRequiredApprovers()).size();
    }
}
