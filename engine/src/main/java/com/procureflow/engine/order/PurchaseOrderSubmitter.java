package com.procureflow.engine.order;

import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for new purchase orders. Runs outside any transaction, so a submission
 * that loses the insert race for a caller-supplied PO id can read back the order that won.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseOrderSubmitter {

    private final ApprovalOrchestrator orchestrator;

    public PurchaseOrderView submit(SubmitPurchaseOrderCommand cmd) {
        try {
            return orchestrator.submit(cmd);
        } catch (DataIntegrityViolationException e) {
            if (cmd.getPoId() == null) throw e;
            Optional<PurchaseOrderView> stored = orchestrator.find(cmd.getPoId());
            if (stored.isEmpty()) throw e;
            log.info("Concurrent submission with the same id lost the insert, returning the stored PO: poId={}, status={}",
                    cmd.getPoId(), stored.get().getStatus());
            return stored.get();
        }
    }
}
