package com.procureflow.engine.order;

import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.procureflow.engine.exception.InvalidTransitionException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically retries the reservation of every {@code pending_budget} purchase order,
 * oldest first. Each PO is retried in its own transaction, so one failure does not
 * hold back the rest of the batch.
 */
@Slf4j
@Component
public class PendingBudgetRetryJob {

    private final ApprovalOrchestrator orchestrator;
    private final Counter retryFailures;

    public PendingBudgetRetryJob(ApprovalOrchestrator orchestrator, MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;
        this.retryFailures = Counter.builder("po.pending_budget.retry.failures").register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${engine.pending-budget.retry-interval-ms:60000}",
               initialDelayString = "${engine.pending-budget.retry-interval-ms:60000}")
    public void retryPendingBudgets() {
        List<String> pending = orchestrator.pendingBudgetIds();
        if (pending.isEmpty()) return;

        int reserved = 0;
        for (String poId : pending) {
            try {
                PurchaseOrderView view = orchestrator.retryReservation(poId);
                if (view.getStatus() != PurchaseOrderStatus.PENDING_BUDGET) reserved++;
            } catch (InvalidTransitionException e) {
                // Cancelled or retried through the API since the id list was read
                log.debug("Skipping PO no longer pending budget: poId={}, state={}", poId, e.getCurrentState());
            } catch (Exception e) {
                retryFailures.increment();
                log.error("Pending-budget retry failed: poId={}, error={}", poId, e.getMessage(), e);
            }
        }
        log.info("Pending-budget retry pass: candidates={}, moved on={}", pending.size(), reserved);
    }
}
