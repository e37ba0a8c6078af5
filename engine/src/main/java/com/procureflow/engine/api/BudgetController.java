package com.procureflow.engine.api;

import java.math.BigDecimal;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.procureflow.engine.budget.AvailabilityCheck;
import com.procureflow.engine.budget.BudgetSummary;
import com.procureflow.engine.budget.ReservationManager;

import lombok.RequiredArgsConstructor;

/**
 * Read-only budget views for the current fiscal year.
 */
@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private final ReservationManager reservationManager;

    @GetMapping("/{departmentId}")
    public ResponseEntity<BudgetSummary> summary(@PathVariable String departmentId) {
        return ResponseEntity.ok(reservationManager.summary(departmentId));
    }

    @GetMapping("/{departmentId}/availability")
    public ResponseEntity<AvailabilityCheck> availability(@PathVariable String departmentId,
                                                          @RequestParam("amount") BigDecimal amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        return ResponseEntity.ok(reservationManager.checkAvailability(departmentId, amount));
    }
}
