package com.procureflow.engine.order;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.procureflow.engine.budget.ReservationManager;
import com.procureflow.engine.budget.ReservationResult;
import com.procureflow.engine.budget.SettlementResult;
import com.procureflow.engine.exception.IneligibleApproverException;
import com.procureflow.engine.exception.InvalidTransitionException;
import com.procureflow.engine.exception.NotFoundException;
import com.procureflow.engine.policy.Approver;
import com.procureflow.engine.policy.PolicyStore;
import com.procureflow.engine.routing.ApprovalRouter;
import com.procureflow.engine.routing.RoutingDecision;
import com.procureflow.shared.events.DomainEvent;
import com.procureflow.shared.events.EventTypes;
import com.procureflow.shared.events.Events.ApprovalRequestedEvent;
import com.procureflow.shared.events.Events.ApproverContact;
import com.procureflow.shared.events.Events.BudgetEscalatedEvent;
import com.procureflow.shared.events.Events.PurchaseOrderApprovedEvent;
import com.procureflow.shared.events.Events.PurchaseOrderBlockedEvent;
import com.procureflow.shared.events.Events.PurchaseOrderCancelledEvent;
import com.procureflow.shared.events.Events.PurchaseOrderPendingBudgetEvent;
import com.procureflow.shared.events.Events.PurchaseOrderRejectedEvent;
import com.procureflow.shared.events.Events.PurchaseOrderSubmittedEvent;
import com.procureflow.shared.outbox.OutboxService;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * PO Approval Orchestrator
 *
 * Drives a purchase order through its lifecycle:
 *
 *   submit → route → [blocked]
 *                  → reserve → [pending_budget]            (insufficient funds, retried later)
 *                            → auto-approved → consume
 *                            → awaiting_approval → all roles approve → consume
 *                                                → any role rejects  → release
 *
 * Every state change and the outbox records describing it commit in one transaction.
 * Operations on an existing PO take its row lock first, so a rejection and the final
 * approval racing each other are serialized and exactly one of them settles the reservation.
 */
@Slf4j
@Service
public class ApprovalOrchestrator {

    private static final String AGGREGATE_TYPE = "PurchaseOrder";

    private final PurchaseOrderRepository purchaseOrderRepository;
    private final ApprovalRouter router;
    private final ReservationManager reservationManager;
    private final PolicyStore policyStore;
    private final OutboxService outboxService;
    private final Clock clock;
    private final int maxReservationAttempts;

    // Metrics
    private final MeterRegistry meterRegistry;
    private final Counter submitted;
    private final Counter budgetEscalations;
    private final Timer submitDuration;

    public ApprovalOrchestrator(
            PurchaseOrderRepository purchaseOrderRepository,
            ApprovalRouter router,
            ReservationManager reservationManager,
            PolicyStore policyStore,
            OutboxService outboxService,
            Clock clock,
            MeterRegistry meterRegistry,
            @Value("${engine.pending-budget.max-attempts:5}") int maxReservationAttempts) {
        this.purchaseOrderRepository = purchaseOrderRepository;
        this.router = router;
        this.reservationManager = reservationManager;
        this.policyStore = policyStore;
        this.outboxService = outboxService;
        this.clock = clock;
        this.maxReservationAttempts = maxReservationAttempts;
        this.meterRegistry = meterRegistry;

        this.submitted         = Counter.builder("po.submitted").register(meterRegistry);
        this.budgetEscalations = Counter.builder("po.budget.escalations").register(meterRegistry);
        this.submitDuration    = Timer.builder("po.submit.duration").register(meterRegistry);
    }

    // ─── Submission ────────────────────────────────────────────────────────────

    /**
     * Create, route and (when not blocked) reserve budget for a new purchase order.
     * A command carrying the id of an existing PO returns that PO unchanged.
     */
    @Transactional
    public PurchaseOrderView submit(SubmitPurchaseOrderCommand cmd) {
        if (cmd.getAmount() == null || cmd.getAmount().signum() <= 0) {
            throw new IllegalArgumentException("Purchase order amount must be positive, got " + cmd.getAmount());
        }
        if (cmd.getPoId() != null) {
            Optional<PurchaseOrder> existing = purchaseOrderRepository.findById(cmd.getPoId());
            if (existing.isPresent()) {
                log.info("Purchase order already submitted, returning it: poId={}", cmd.getPoId());
                return PurchaseOrderView.of(existing.get());
            }
        }

        return submitDuration.record(() -> {
            String poId = cmd.getPoId() != null ? cmd.getPoId() : newPoId();
            PurchaseOrder po = PurchaseOrder.builder()
                    .id(poId)
                    .departmentId(cmd.getDepartmentId())
                    .supplierId(cmd.getSupplierId())
                    .amount(cmd.getAmount())
                    .requestedBy(cmd.getRequestedBy())
                    .description(cmd.getDescription())
                    .status(PurchaseOrderStatus.DRAFT)
                    .build();
            purchaseOrderRepository.save(po);
            append(po, EventTypes.TOPIC_PO_SUBMITTED, new PurchaseOrderSubmittedEvent(
                    poId, po.getDepartmentId(), po.getSupplierId(), po.getAmount(), po.getRequestedBy()));
            submitted.increment();

            RoutingDecision decision = router.route(po.getSupplierId(), po.getAmount());
            po.applyRouting(decision);
            po.transitionTo(PurchaseOrderStatus.ROUTED);

            if (decision.isBlocked()) {
                block(po, decision);
            } else {
                attemptReservation(po, decision);
            }

            purchaseOrderRepository.save(po);
            log.info("Purchase order submitted: poId={}, department={}, supplier={}, amount={}, status={}, reason={}",
                    poId, po.getDepartmentId(), po.getSupplierId(), po.getAmount(), po.getStatus(), po.getDecisionReason());
            return PurchaseOrderView.of(po);
        });
    }

    // ─── Approver actions ──────────────────────────────────────────────────────

    /**
     * Record one approver decision. The first rejection is final; the PO is approved
     * once every required role has approved, in any order. A repeated approval by the
     * same role changes nothing.
     */
    @Transactional
    public PurchaseOrderView recordAction(String poId, String role, ApprovalDecision decision, String comment) {
        PurchaseOrder po = lockPurchaseOrder(poId);

        if (po.getStatus() != PurchaseOrderStatus.AWAITING_APPROVAL) {
            throw new InvalidTransitionException(poId, po.getStatus(), decision.wireName());
        }
        if (!po.getRequiredRoles().contains(role)) {
            throw new IneligibleApproverException(poId, role, "not a required approver (required: " + po.getRequiredRoles() + ")");
        }
        if (!policyStore.isActive(role)) {
            throw new IneligibleApproverException(poId, role, "approver is inactive or not provisioned");
        }
        if (decision == ApprovalDecision.APPROVE && po.hasApproved(role)) {
            log.info("Duplicate approval ignored: poId={}, role={}", poId, role);
            return PurchaseOrderView.of(po);
        }

        po.recordAction(role, decision, comment, clock.instant());
        actionCounter(decision).increment();

        if (decision == ApprovalDecision.REJECT) {
            reject(po, role, comment);
        } else if (po.isFullyApproved()) {
            approveAndConsume(po, false);
        } else {
            po.setDecisionReason(awaitingReason(po.pendingRoles()));
        }

        purchaseOrderRepository.save(po);
        log.info("Approval action recorded: poId={}, role={}, decision={}, status={}",
                poId, role, decision, po.getStatus());
        return PurchaseOrderView.of(po);
    }

    // ─── Cancellation ──────────────────────────────────────────────────────────

    /** Withdraw a PO that is waiting on approvers or on budget, freeing any reservation. */
    @Transactional
    public PurchaseOrderView cancel(String poId, String reason) {
        PurchaseOrder po = lockPurchaseOrder(poId);

        if (po.getStatus() != PurchaseOrderStatus.AWAITING_APPROVAL
                && po.getStatus() != PurchaseOrderStatus.PENDING_BUDGET) {
            throw new InvalidTransitionException(poId, po.getStatus(), "cancel");
        }

        boolean released = false;
        if (po.getReservationId() != null) {
            released = reservationManager.release(po.getReservationId()).changedBalances();
        }
        po.transitionTo(PurchaseOrderStatus.RELEASED);
        po.setDecisionReason("Cancelled: " + (reason != null ? reason : "no reason given"));
        po.setCompletedAt(clock.instant());
        append(po, EventTypes.TOPIC_PO_CANCELLED, new PurchaseOrderCancelledEvent(poId, reason, released));

        purchaseOrderRepository.save(po);
        log.info("Purchase order cancelled: poId={}, reservationReleased={}, reason={}", poId, released, reason);
        return PurchaseOrderView.of(po);
    }

    // ─── Pending budget ────────────────────────────────────────────────────────

    /**
     * Re-route with current supplier and policy data, then try the reservation again.
     * A PO still short of budget stays {@code pending_budget}.
     */
    @Transactional
    public PurchaseOrderView retryReservation(String poId) {
        PurchaseOrder po = lockPurchaseOrder(poId);

        if (po.getStatus() != PurchaseOrderStatus.PENDING_BUDGET) {
            throw new InvalidTransitionException(poId, po.getStatus(), "retry-reservation");
        }

        RoutingDecision decision = router.route(po.getSupplierId(), po.getAmount());
        po.applyRouting(decision);
        if (decision.isBlocked()) {
            block(po, decision);
        } else {
            attemptReservation(po, decision);
        }

        purchaseOrderRepository.save(po);
        log.info("Reservation retried: poId={}, attempt={}, status={}", poId, po.getReservationAttempts(), po.getStatus());
        return PurchaseOrderView.of(po);
    }

    // ─── Queries ───────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public PurchaseOrderView get(String poId) {
        return PurchaseOrderView.of(findPurchaseOrder(poId));
    }

    @Transactional(readOnly = true)
    public Optional<PurchaseOrderView> find(String poId) {
        return purchaseOrderRepository.findById(poId).map(PurchaseOrderView::of);
    }

    @Transactional(readOnly = true)
    public List<ApprovalActionView> actions(String poId) {
        return findPurchaseOrder(poId).getActions().stream().map(ApprovalActionView::of).toList();
    }

    @Transactional(readOnly = true)
    public List<PurchaseOrderView> listByStatus(PurchaseOrderStatus status) {
        return purchaseOrderRepository.findByStatusOrderByCreatedAtAsc(status).stream()
                .map(PurchaseOrderView::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<String> pendingBudgetIds() {
        return purchaseOrderRepository.findIdsByStatus(PurchaseOrderStatus.PENDING_BUDGET);
    }

    // ─── Internals ─────────────────────────────────────────────────────────────

    private void attemptReservation(PurchaseOrder po, RoutingDecision decision) {
        int attempt = po.incrementReservationAttempts();
        ReservationResult result = reservationManager.reserve(po.getDepartmentId(), po.getAmount(), po.getId());

        if (!result.isReserved()) {
            holdForBudget(po, result, attempt);
            return;
        }

        po.setReservationId(result.getReservation().getId());
        po.transitionTo(PurchaseOrderStatus.RESERVED);

        if (decision.isAutoApproved()) {
            approveAndConsume(po, true);
            return;
        }

        po.transitionTo(PurchaseOrderStatus.AWAITING_APPROVAL);
        po.setDecisionReason(awaitingReason(po.getRequiredRoles()));
        append(po, EventTypes.TOPIC_PO_APPROVAL_REQUESTED, new ApprovalRequestedEvent(
                po.getId(), po.getAmount(), contactsFor(po.getRequiredRoles()), po.isEscalated()));
    }

    private void holdForBudget(PurchaseOrder po, ReservationResult result, int attempt) {
        po.setDecisionReason(String.format("Insufficient budget: requested %s, available %s",
                result.getRequested(), result.getAvailable()));

        if (po.getStatus() != PurchaseOrderStatus.PENDING_BUDGET) {
            po.transitionTo(PurchaseOrderStatus.PENDING_BUDGET);
            append(po, EventTypes.TOPIC_PO_PENDING_BUDGET, new PurchaseOrderPendingBudgetEvent(
                    po.getId(), po.getDepartmentId(), result.getRequested(), result.getAvailable(), attempt));
        }

        if (attempt >= maxReservationAttempts && !po.isBudgetEscalated()) {
            po.setBudgetEscalated(true);
            budgetEscalations.increment();
            append(po, EventTypes.TOPIC_PO_BUDGET_ESCALATED, new BudgetEscalatedEvent(
                    po.getId(), po.getDepartmentId(), po.getAmount(), attempt));
            log.warn("Pending-budget retries exhausted, escalating: poId={}, department={}, attempts={}",
                    po.getId(), po.getDepartmentId(), attempt);
        }
    }

    private void block(PurchaseOrder po, RoutingDecision decision) {
        po.transitionTo(PurchaseOrderStatus.BLOCKED);
        po.setCompletedAt(clock.instant());
        append(po, EventTypes.TOPIC_PO_BLOCKED,
                new PurchaseOrderBlockedEvent(po.getId(), po.getSupplierId(), decision.getReason()));
        log.warn("Purchase order blocked: poId={}, reason={}", po.getId(), decision.getReason());
    }

    private void approveAndConsume(PurchaseOrder po, boolean autoApproved) {
        po.transitionTo(PurchaseOrderStatus.APPROVED);
        append(po, EventTypes.TOPIC_PO_APPROVED, new PurchaseOrderApprovedEvent(
                po.getId(), po.getDepartmentId(), po.getAmount(), autoApproved));

        SettlementResult settlement = reservationManager.consume(po.getReservationId());
        po.transitionTo(PurchaseOrderStatus.CONSUMED);
        po.setCompletedAt(clock.instant());
        if (!autoApproved) {
            po.setDecisionReason("Approved by: " + String.join(", ", po.getRequiredRoles()));
        }
        log.info("Purchase order approved: poId={}, auto={}, settlement={}", po.getId(), autoApproved, settlement.getOutcome());
    }

    private void reject(PurchaseOrder po, String role, String comment) {
        po.transitionTo(PurchaseOrderStatus.REJECTED);
        String reason = "Rejected by " + role + (comment != null && !comment.isBlank() ? ": " + comment : "");
        po.setDecisionReason(reason);
        append(po, EventTypes.TOPIC_PO_REJECTED, new PurchaseOrderRejectedEvent(po.getId(), role, comment));

        SettlementResult settlement = reservationManager.release(po.getReservationId());
        po.transitionTo(PurchaseOrderStatus.RELEASED);
        po.setCompletedAt(clock.instant());
        log.info("Purchase order rejected: poId={}, role={}, settlement={}", po.getId(), role, settlement.getOutcome());
    }

    private List<ApproverContact> contactsFor(List<String> roles) {
        Map<String, Approver> approvers = policyStore.approversFor(roles);
        return roles.stream()
                .map(role -> {
                    Approver a = approvers.get(role);
                    return a != null
                            ? new ApproverContact(role, a.getName(), a.getEmail())
                            : new ApproverContact(role, null, null);
                })
                .toList();
    }

    private static String awaitingReason(List<String> roles) {
        return "Awaiting approval from: " + String.join(", ", roles);
    }

    private PurchaseOrder lockPurchaseOrder(String poId) {
        return purchaseOrderRepository.findByIdForUpdate(poId)
                .orElseThrow(() -> new NotFoundException("PurchaseOrder", poId));
    }

    private PurchaseOrder findPurchaseOrder(String poId) {
        return purchaseOrderRepository.findById(poId)
                .orElseThrow(() -> new NotFoundException("PurchaseOrder", poId));
    }

    private void append(PurchaseOrder po, String topic, DomainEvent event) {
        outboxService.append(po.getId(), AGGREGATE_TYPE, topic, event);
    }

    private Counter actionCounter(ApprovalDecision decision) {
        return Counter.builder("po.approval.actions")
                .tag("decision", decision.wireName())
                .register(meterRegistry);
    }

    private String newPoId() {
        return "PO-" + clock.millis() + "-" + UUID.randomUUID().toString().substring(0, 6);
    }
}
