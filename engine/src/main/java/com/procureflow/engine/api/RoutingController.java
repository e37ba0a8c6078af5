package com.procureflow.engine.api;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.procureflow.engine.policy.ApprovalRule;
import com.procureflow.engine.policy.PolicyStore;
import com.procureflow.engine.routing.ApprovalRouter;
import com.procureflow.engine.routing.RoutingDecision;

import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * Routing preview and the effective approval matrix. Nothing here creates or changes a PO.
 */
@RestController
@RequestMapping("/api/routing")
@RequiredArgsConstructor
public class RoutingController {

    private final ApprovalRouter router;
    private final PolicyStore policyStore;

    @GetMapping("/preview")
    public ResponseEntity<RoutingDecision> preview(@RequestParam("supplierId") String supplierId,
                                                   @RequestParam("amount") BigDecimal amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        return ResponseEntity.ok(router.route(supplierId, amount));
    }

    @GetMapping("/matrix")
    public ResponseEntity<List<MatrixEntry>> matrix() {
        return ResponseEntity.ok(policyStore.matrix().brackets().stream()
                .map(MatrixEntry::of)
                .toList());
    }

    @Value
    static class MatrixEntry {
        Long ruleId;
        BigDecimal maxAmount;
        List<String> requiredApprovers;
        boolean autoApprove;
        String description;

        static MatrixEntry of(ApprovalRule rule) {
            return new MatrixEntry(rule.getId(), rule.getMaxAmount(), List.copyOf(rule.getRequiredApprovers()),
                    rule.isAutoApprove(), rule.getDescription());
        }
    }
}
