package com.procureflow.engine.policy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the approval matrix and the approver roster.
 *
 * Rows are re-read on every call: the bulk importer may change them at any time
 * and a routing decision must reflect the data as it is when the decision is made.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PolicyStore {

    private final ApprovalRuleRepository ruleRepository;
    private final ApproverRepository approverRepository;
    private final Clock clock;

    public ApprovalMatrix matrix() {
        return ApprovalMatrix.of(ruleRepository.findByActiveTrue(), clock.instant());
    }

    public RuleLookup findRule(BigDecimal amount) {
        ApprovalMatrix matrix = matrix();
        return matrix.tightestFor(amount)
                .map(rule -> RuleLookup.matched(rule, amount))
                .orElseGet(() -> {
                    log.warn("No approval bracket covers amount={} ({} effective brackets); manual escalation required",
                            amount, matrix.brackets().size());
                    return RuleLookup.requiresEscalation(amount);
                });
    }

    public Optional<Approver> findApprover(String role) {
        return approverRepository.findById(role);
    }

    public boolean isActive(String role) {
        return findApprover(role).map(Approver::isActive).orElse(false);
    }

    /** Approvers for the given roles, keyed by role, in the order given. Unknown roles are absent. */
    public Map<String, Approver> approversFor(Collection<String> roles) {
        Map<String, Approver> found = new LinkedHashMap<>();
        Map<String, Approver> byRole = new LinkedHashMap<>();
        approverRepository.findAllById(roles).forEach(a -> byRole.put(a.getRole(), a));
        for (String role : roles) {
            Approver approver = byRole.get(role);
            if (approver != null) found.put(role, approver);
        }
        return found;
    }
}
