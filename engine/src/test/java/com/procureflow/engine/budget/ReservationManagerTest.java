package com.procureflow.engine.budget;

import com.procureflow.engine.exception.NotFoundException;
import com.procureflow.shared.events.EventTypes;
import com.procureflow.shared.events.Events.BudgetConsumedEvent;
import com.procureflow.shared.events.Events.BudgetReservedEvent;
import com.procureflow.shared.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit Tests: ReservationManager
 *
 * Repositories and the outbox are mocked; the row lock itself is exercised in
 * {@link ReservationConcurrencyTest}.
 */
@ExtendWith(MockitoExtension.class)
class ReservationManagerTest {

    @Mock BudgetRepository budgetRepository;
    @Mock BudgetReservationRepository reservationRepository;
    @Mock OutboxService outboxService;

    SimpleMeterRegistry meterRegistry;
    ReservationManager manager;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2026-05-10T09:00:00Z"), ZoneOffset.UTC);
        manager = new ReservationManager(budgetRepository, reservationRepository, outboxService, clock, meterRegistry);
    }

    private Budget budget(String allocated, String spent, String reserved) {
        return Budget.builder().id(11L).departmentId("ENG").fiscalYear(2026)
                .allocated(new BigDecimal(allocated))
                .spent(new BigDecimal(spent))
                .reserved(new BigDecimal(reserved))
                .build();
    }

    private void savedReservationsGetIds() {
        when(reservationRepository.save(any(BudgetReservation.class))).thenAnswer(inv -> {
            BudgetReservation r = inv.getArgument(0);
            if (r.getId() == null) r.setId(101L);
            return r;
        });
    }

    // ─── reserve ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("reserve: increments reserved, inserts an active reservation, appends budget.reserved")
    void reserveSucceeds() {
        Budget budget = budget("10000", "2000", "0");
        when(budgetRepository.findForUpdate("ENG", 2026)).thenReturn(Optional.of(budget));
        when(reservationRepository.findFirstByPoIdAndStatus("PO-1", ReservationStatus.ACTIVE)).thenReturn(Optional.empty());
        savedReservationsGetIds();

        ReservationResult result = manager.reserve("ENG", new BigDecimal("5000"), "PO-1");

        assertThat(result.isReserved()).isTrue();
        assertThat(result.getReservation().getStatus()).isEqualTo(ReservationStatus.ACTIVE);
        assertThat(result.getReservation().getBudgetId()).isEqualTo(11L);
        assertThat(result.getAvailable()).isEqualByComparingTo("3000");
        assertThat(budget.getReserved()).isEqualByComparingTo("5000");
        verify(outboxService).append(eq("PO-1"), eq("BudgetReservation"), eq(EventTypes.TOPIC_BUDGET_RESERVED),
                argThat(e -> e instanceof BudgetReservedEvent && ((BudgetReservedEvent) e).getReservationId() == 101L));
        assertThat(meterRegistry.counter("budget.reservations", "outcome", "reserved").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("reserve: insufficient budget is a result, not an exception, and changes nothing")
    void reserveInsufficient() {
        Budget budget = budget("10000", "2000", "7000");
        when(budgetRepository.findForUpdate("ENG", 2026)).thenReturn(Optional.of(budget));
        when(reservationRepository.findFirstByPoIdAndStatus("PO-3", ReservationStatus.ACTIVE)).thenReturn(Optional.empty());

        ReservationResult result = manager.reserve("ENG", new BigDecimal("2000"), "PO-3");

        assertThat(result.isReserved()).isFalse();
        assertThat(result.getOutcome()).isEqualTo(ReservationResult.Outcome.INSUFFICIENT_BUDGET);
        assertThat(result.getAvailable()).isEqualByComparingTo("1000");
        assertThat(budget.getReserved()).isEqualByComparingTo("7000");
        verify(reservationRepository, never()).save(any());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("reserve: a PO with an active reservation gets it back unchanged")
    void reserveIdempotentPerPo() {
        Budget budget = budget("10000", "0", "500");
        BudgetReservation existing = BudgetReservation.builder().id(7L).poId("PO-1").budgetId(11L)
                .departmentId("ENG").amount(new BigDecimal("500")).status(ReservationStatus.ACTIVE).build();
        when(budgetRepository.findForUpdate("ENG", 2026)).thenReturn(Optional.of(budget));
        when(reservationRepository.findFirstByPoIdAndStatus("PO-1", ReservationStatus.ACTIVE)).thenReturn(Optional.of(existing));

        ReservationResult result = manager.reserve("ENG", new BigDecimal("500"), "PO-1");

        assertThat(result.getReservation()).isSameAs(existing);
        assertThat(budget.getReserved()).isEqualByComparingTo("500");
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("reserve: non-positive amounts are rejected before touching the budget")
    void reserveRejectsNonPositive() {
        assertThatThrownBy(() -> manager.reserve("ENG", BigDecimal.ZERO, "PO-1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.reserve("ENG", new BigDecimal("-5"), "PO-1"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(budgetRepository);
    }

    @Test
    @DisplayName("reserve: unknown department budget for the fiscal year is NotFound")
    void reserveUnknownDepartment() {
        when(budgetRepository.findForUpdate("NOPE", 2026)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> manager.reserve("NOPE", BigDecimal.TEN, "PO-1"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("NOPE");
    }

    // ─── release / consume ────────────────────────────────────────────────────

    @Test
    @DisplayName("consume: reserved -> spent, reservation CONSUMED with settled_at")
    void consume() {
        Budget budget = budget("10000", "2000", "5000");
        BudgetReservation reservation = BudgetReservation.builder().id(7L).poId("PO-1").budgetId(11L)
                .departmentId("ENG").amount(new BigDecimal("5000")).status(ReservationStatus.ACTIVE).build();
        when(reservationRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(reservation));
        when(budgetRepository.findByIdForUpdate(11L)).thenReturn(Optional.of(budget));

        SettlementResult result = manager.consume(7L);

        assertThat(result.getOutcome()).isEqualTo(SettlementResult.Outcome.CONSUMED);
        assertThat(budget.getReserved()).isEqualByComparingTo("0");
        assertThat(budget.getSpent()).isEqualByComparingTo("7000");
        assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.CONSUMED);
        assertThat(reservation.getSettledAt()).isEqualTo(Instant.parse("2026-05-10T09:00:00Z"));
        verify(outboxService).append(eq("PO-1"), eq("BudgetReservation"), eq(EventTypes.TOPIC_BUDGET_CONSUMED),
                any(BudgetConsumedEvent.class));
    }

    @Test
    @DisplayName("release after consume: AlreadyTerminal, balances untouched")
    void releaseAfterConsume() {
        BudgetReservation reservation = BudgetReservation.builder().id(7L).poId("PO-1").budgetId(11L)
                .departmentId("ENG").amount(new BigDecimal("5000")).status(ReservationStatus.CONSUMED).build();
        when(reservationRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(reservation));

        SettlementResult result = manager.release(7L);

        assertThat(result.getOutcome()).isEqualTo(SettlementResult.Outcome.ALREADY_TERMINAL);
        assertThat(result.getFinalStatus()).isEqualTo(ReservationStatus.CONSUMED);
        assertThat(result.changedBalances()).isFalse();
        verifyNoInteractions(budgetRepository, outboxService);
    }

    @Test
    @DisplayName("release: unknown reservation is NotFound")
    void releaseUnknown() {
        when(reservationRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> manager.release(99L)).isInstanceOf(NotFoundException.class);
    }

    // ─── summary ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("summary: balances, available and utilization for the current fiscal year")
    void summary() {
        Budget budget = budget("10000", "2500", "1000");
        budget.setDepartmentName("Engineering");
        when(budgetRepository.findByDepartmentIdAndFiscalYear("ENG", 2026)).thenReturn(Optional.of(budget));

        BudgetSummary summary = manager.summary("ENG");

        assertThat(summary.getAvailable()).isEqualByComparingTo("6500");
        assertThat(summary.getUtilizationPercent()).isEqualByComparingTo("25.00");
        assertThat(summary.getFiscalYear()).isEqualTo(2026);
        assertThat(summary.getDepartmentName()).isEqualTo("Engineering");
    }
}
