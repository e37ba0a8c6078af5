package com.procureflow.engine.api;

import java.math.BigDecimal;
import java.net.URI;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.procureflow.engine.order.ApprovalActionView;
import com.procureflow.engine.order.ApprovalDecision;
import com.procureflow.engine.order.ApprovalOrchestrator;
import com.procureflow.engine.order.PurchaseOrderStatus;
import com.procureflow.engine.order.PurchaseOrderSubmitter;
import com.procureflow.engine.order.PurchaseOrderView;
import com.procureflow.engine.order.SubmitPurchaseOrderCommand;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Purchase Order REST Controller
 *
 * Write endpoints: POST /api/purchase-orders, POST /{id}/actions, POST /{id}/cancel, POST /{id}/retry-reservation
 * Read endpoints:  GET /api/purchase-orders/{id}, GET /{id}/actions, GET /api/purchase-orders?status=
 *
 * A blocked or pending-budget PO is still a successful submission: the body carries the status and reason.
 * An {@code Idempotency-Key} header (at most 50 characters) becomes the PO id.
 */
@Slf4j
@RestController
@Validated
@RequestMapping("/api/purchase-orders")
@RequiredArgsConstructor
public class PurchaseOrderController {

    private final ApprovalOrchestrator orchestrator;
    private final PurchaseOrderSubmitter submitter;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<PurchaseOrderView> submit(
            @Valid @RequestBody SubmitPurchaseOrderRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) @Size(max = 50) String idempotencyKey) {

        SubmitPurchaseOrderCommand command = SubmitPurchaseOrderCommand.builder()
                .departmentId(request.getDepartmentId())
                .supplierId(request.getSupplierId())
                .amount(request.getAmount())
                .requestedBy(request.getRequestedBy())
                .description(request.getDescription())
                .poId(idempotencyKey)
                .build();

        PurchaseOrderView view = submitter.submit(command);
        return ResponseEntity
                .created(URI.create("/api/purchase-orders/" + view.getPoId()))
                .body(view);
    }

    @PostMapping("/{poId}/actions")
    public ResponseEntity<PurchaseOrderView> recordAction(
            @PathVariable String poId,
            @Valid @RequestBody ApprovalActionRequest request) {
        return ResponseEntity.ok(orchestrator.recordAction(
                poId, request.getRole(), request.getDecision(), request.getComment()));
    }

    @PostMapping("/{poId}/cancel")
    public ResponseEntity<PurchaseOrderView> cancel(
            @PathVariable String poId,
            @RequestBody(required = false) CancelRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(orchestrator.cancel(poId, reason));
    }

    @PostMapping("/{poId}/retry-reservation")
    public ResponseEntity<PurchaseOrderView> retryReservation(@PathVariable String poId) {
        return ResponseEntity.ok(orchestrator.retryReservation(poId));
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping("/{poId}")
    public ResponseEntity<PurchaseOrderView> get(@PathVariable String poId) {
        return ResponseEntity.ok(orchestrator.get(poId));
    }

    @GetMapping("/{poId}/actions")
    public ResponseEntity<List<ApprovalActionView>> actions(@PathVariable String poId) {
        return ResponseEntity.ok(orchestrator.actions(poId));
    }

    @GetMapping
    public ResponseEntity<List<PurchaseOrderView>> listByStatus(@RequestParam("status") String status) {
        return ResponseEntity.ok(orchestrator.listByStatus(PurchaseOrderStatus.fromWire(status)));
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class SubmitPurchaseOrderRequest {
    @NotBlank @Size(max = 50) private String departmentId;
    @NotBlank @Size(max = 50) private String supplierId;
    @NotNull @DecimalMin(value = "0.01") @Digits(integer = 13, fraction = 2) private BigDecimal amount;
    @NotBlank @Size(max = 100) private String requestedBy;
    @Size(max = 1000) private String description;
}

@Data
class ApprovalActionRequest {
    @NotBlank private String role;
    @NotNull private ApprovalDecision decision;
    @Size(max = 1000) private String comment;
}

@Data
class CancelRequest {
    @Size(max = 500) private String reason;
}
