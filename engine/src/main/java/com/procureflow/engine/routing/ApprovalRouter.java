package com.procureflow.engine.routing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.procureflow.engine.policy.ApprovalRule;
import com.procureflow.engine.policy.Approver;
import com.procureflow.engine.policy.PolicyStore;
import com.procureflow.engine.policy.RuleLookup;
import com.procureflow.engine.supplier.Supplier;
import com.procureflow.engine.supplier.SupplierRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a purchase order is blocked, auto-approved, or needs sign-off and from whom.
 *
 * Supplier checks come first and override everything the matrix says: a suspended
 * supplier or an amount above the supplier's order cap blocks the PO outright.
 * Reads only; a decision is a function of the current policy and supplier rows.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class ApprovalRouter {

    private final PolicyStore policyStore;
    private final SupplierRegistry supplierRegistry;
    private final String fallbackRole;

    public ApprovalRouter(PolicyStore policyStore,
                          SupplierRegistry supplierRegistry,
                          @Value("${engine.routing.fallback-role:director}") String fallbackRole) {
        this.policyStore = policyStore;
        this.supplierRegistry = supplierRegistry;
        this.fallbackRole = fallbackRole;
    }

    public RoutingDecision route(String supplierId, BigDecimal amount) {
        Supplier supplier = supplierRegistry.getSupplier(supplierId);

        if (supplier.isSuspended()) {
            return logged(RoutingDecision.blocked("Supplier " + supplierId + " is suspended"), supplierId, amount);
        }
        if (supplier.exceedsMaxOrderValue(amount)) {
            return logged(RoutingDecision.blocked(String.format(
                    "Amount %s exceeds supplier %s max order value %s",
                    amount, supplierId, supplier.getMaxOrderValue())), supplierId, amount);
        }

        RuleLookup lookup = policyStore.findRule(amount);
        if (lookup.requiresManualEscalation()) {
            return logged(RoutingDecision.requires(List.of(fallbackRole), null, true, String.format(
                    "No approval rule covers amount %s; escalated to %s", amount, fallbackRole)), supplierId, amount);
        }

        ApprovalRule rule = lookup.getRule();
        if (rule.isAutoApprove() && !supplier.isHighRisk() && supplier.isApproved()) {
            return logged(RoutingDecision.autoApproved(rule.getId(), String.format(
                    "Auto-approved under rule %d (max %s)", rule.getId(), rule.getMaxAmount())), supplierId, amount);
        }

        return logged(manualRouting(rule, supplier), supplierId, amount);
    }

    private RoutingDecision manualRouting(ApprovalRule rule, Supplier supplier) {
        Set<String> distinct = new LinkedHashSet<>(rule.getRequiredApprovers());
        Map<String, Approver> approvers = policyStore.approversFor(distinct);

        List<String> active = new ArrayList<>();
        List<String> inactive = new ArrayList<>();
        for (String role : distinct) {
            Approver approver = approvers.get(role);
            if (approver != null && approver.isActive()) active.add(role);
            else inactive.add(role);
        }

        String why = rule.isAutoApprove()
                ? autoApproveOverride(supplier)
                : String.format("Rule %d (max %s) requires approval", rule.getId(), rule.getMaxAmount());

        if (active.isEmpty()) {
            return RoutingDecision.requires(List.of(fallbackRole), rule.getId(), true, String.format(
                    "%s; no active approver among %s, escalated to %s", why, distinct, fallbackRole));
        }
        if (!inactive.isEmpty()) {
            why = why + "; skipped inactive " + inactive;
        }
        return RoutingDecision.requires(active, rule.getId(), false, why + " from: " + String.join(", ", active));
    }

    private static String autoApproveOverride(Supplier supplier) {
        if (supplier.isHighRisk()) {
            return "Auto-approve overridden: supplier " + supplier.getSupplierId() + " is high risk";
        }
        return "Auto-approve overridden: supplier " + supplier.getSupplierId() + " status is " + supplier.getStatus();
    }

    private static RoutingDecision logged(RoutingDecision decision, String supplierId, BigDecimal amount) {
        log.debug("Routing decision: supplier={}, amount={}, type={}, roles={}, reason={}",
                supplierId, amount, decision.getType(), decision.getRequiredRoles(), decision.getReason());
        return decision;
    }

    public String fallbackRole() {
        return fallbackRole;
    }
}
