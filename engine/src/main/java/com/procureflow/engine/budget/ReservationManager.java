package com.procureflow.engine.budget;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.procureflow.engine.exception.NotFoundException;
import com.procureflow.shared.events.EventTypes;
import com.procureflow.shared.events.Events.BudgetConsumedEvent;
import com.procureflow.shared.events.Events.BudgetReleasedEvent;
import com.procureflow.shared.events.Events.BudgetReservedEvent;
import com.procureflow.shared.outbox.OutboxService;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Sole writer of {@code budgets.reserved} and {@code budgets.spent}.
 *
 * Each operation is one short transaction holding the department's budget row lock.
 * Departments never block each other; reservations for the same department queue on the row.
 * {@code reserve} never waits for funds to appear: an insufficient balance is returned as a result.
 *
 * Lock order: reservation row, then budget row. Callers that also hold a PO row lock
 * must have taken it first.
 */
@Slf4j
@Service
public class ReservationManager {

    private static final String AGGREGATE_TYPE = "BudgetReservation";

    private final BudgetRepository budgetRepository;
    private final BudgetReservationRepository reservationRepository;
    private final OutboxService outboxService;
    private final Clock clock;

    private final Counter reservedCounter;
    private final Counter insufficientCounter;
    private final Counter releasedCounter;
    private final Counter consumedCounter;

    public ReservationManager(BudgetRepository budgetRepository,
                              BudgetReservationRepository reservationRepository,
                              OutboxService outboxService,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.budgetRepository = budgetRepository;
        this.reservationRepository = reservationRepository;
        this.outboxService = outboxService;
        this.clock = clock;
        this.reservedCounter = counter(meterRegistry, "reserved");
        this.insufficientCounter = counter(meterRegistry, "insufficient_budget");
        this.releasedCounter = counter(meterRegistry, "released");
        this.consumedCounter = counter(meterRegistry, "consumed");
    }

    private static Counter counter(MeterRegistry registry, String outcome) {
        return Counter.builder("budget.reservations")
                .description("Budget reservation operations by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }

    /**
     * Reserve {@code amount} against the department's current fiscal-year budget.
     * Returns the existing reservation unchanged when the PO already holds an active one.
     */
    @Transactional
    public ReservationResult reserve(String departmentId, BigDecimal amount, String poId) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Reservation amount must be positive, got " + amount);
        }

        Budget budget = budgetRepository.findForUpdate(departmentId, currentFiscalYear())
                .orElseThrow(() -> new NotFoundException("Budget", departmentId + "/" + currentFiscalYear()));

        // Idempotency: checked under the budget lock so two racing calls for one PO cannot both insert
        Optional<BudgetReservation> existing =
                reservationRepository.findFirstByPoIdAndStatus(poId, ReservationStatus.ACTIVE);
        if (existing.isPresent()) {
            log.info("Active reservation already held, returning it: poId={}, reservationId={}",
                    poId, existing.get().getId());
            return ReservationResult.reserved(existing.get(), budget.available());
        }

        if (!budget.hasAvailable(amount)) {
            insufficientCounter.increment();
            log.info("Insufficient budget: department={}, requested={}, available={}, poId={}",
                    departmentId, amount, budget.available(), poId);
            return ReservationResult.insufficient(amount, budget.available());
        }

        budget.reserve(amount);
        budgetRepository.save(budget);

        BudgetReservation reservation = reservationRepository.save(BudgetReservation.builder()
                .poId(poId)
                .budgetId(budget.getId())
                .departmentId(departmentId)
                .amount(amount)
                .status(ReservationStatus.ACTIVE)
                .createdAt(clock.instant())
                .build());

        outboxService.append(poId, AGGREGATE_TYPE, EventTypes.TOPIC_BUDGET_RESERVED,
                new BudgetReservedEvent(reservation.getId(), poId, departmentId, amount, budget.available()));

        reservedCounter.increment();
        log.info("Budget reserved: department={}, amount={}, poId={}, reservationId={}, availableAfter={}",
                departmentId, amount, poId, reservation.getId(), budget.available());
        return ReservationResult.reserved(reservation, budget.available());
    }

    /** Return a reservation's amount to the department's headroom. */
    @Transactional
    public SettlementResult release(Long reservationId) {
        return settle(reservationId, ReservationStatus.RELEASED);
    }

    /** Convert a reservation into recognised spend. */
    @Transactional
    public SettlementResult consume(Long reservationId) {
        return settle(reservationId, ReservationStatus.CONSUMED);
    }

    private SettlementResult settle(Long reservationId, ReservationStatus target) {
        BudgetReservation reservation = reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> new NotFoundException("Reservation", reservationId));

        if (reservation.getStatus().isTerminal()) {
            log.info("Reservation already settled: reservationId={}, status={}, requested={}",
                    reservationId, reservation.getStatus(), target);
            return new SettlementResult(SettlementResult.Outcome.ALREADY_TERMINAL, reservationId, reservation.getStatus());
        }

        Budget budget = budgetRepository.findByIdForUpdate(reservation.getBudgetId())
                .orElseThrow(() -> new NotFoundException("Budget", reservation.getBudgetId()));

        BigDecimal amount = reservation.getAmount();
        String poId = reservation.getPoId();
        if (target == ReservationStatus.RELEASED) {
            budget.release(amount);
            outboxService.append(poId, AGGREGATE_TYPE, EventTypes.TOPIC_BUDGET_RELEASED,
                    new BudgetReleasedEvent(reservationId, poId, reservation.getDepartmentId(), amount));
            releasedCounter.increment();
        } else {
            budget.consume(amount);
            outboxService.append(poId, AGGREGATE_TYPE, EventTypes.TOPIC_BUDGET_CONSUMED,
                    new BudgetConsumedEvent(reservationId, poId, reservation.getDepartmentId(), amount));
            consumedCounter.increment();
        }
        reservation.settle(target, clock.instant());
        budgetRepository.save(budget);
        reservationRepository.save(reservation);

        log.info("Reservation {}: reservationId={}, department={}, amount={}, poId={}",
                target.name().toLowerCase(), reservationId, reservation.getDepartmentId(), amount, poId);
        return new SettlementResult(target == ReservationStatus.RELEASED
                ? SettlementResult.Outcome.RELEASED : SettlementResult.Outcome.CONSUMED,
                reservationId, target);
    }

    @Transactional(readOnly = true)
    public BudgetSummary summary(String departmentId) {
        return BudgetSummary.of(currentBudget(departmentId));
    }

    @Transactional(readOnly = true)
    public AvailabilityCheck checkAvailability(String departmentId, BigDecimal amount) {
        Budget budget = currentBudget(departmentId);
        return new AvailabilityCheck(departmentId, amount, budget.available(), budget.hasAvailable(amount));
    }

    @Transactional(readOnly = true)
    public Optional<BudgetReservation> findReservation(Long reservationId) {
        return reservationRepository.findById(reservationId);
    }

    private Budget currentBudget(String departmentId) {
        int year = currentFiscalYear();
        return budgetRepository.findByDepartmentIdAndFiscalYear(departmentId, year)
                .orElseThrow(() -> new NotFoundException("Budget", departmentId + "/" + year));
    }

    private int currentFiscalYear() {
        return LocalDate.now(clock).getYear();
    }
}
