package com.procureflow.engine.budget;

import com.procureflow.engine.exception.BudgetInvariantViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BudgetTest {

    private static Budget budget(String allocated, String spent, String reserved) {
        return Budget.builder()
                .departmentId("ENG")
                .allocated(new BigDecimal(allocated))
                .spent(new BigDecimal(spent))
                .reserved(new BigDecimal(reserved))
                .fiscalYear(2026)
                .build();
    }

    @Test
    @DisplayName("available = allocated - spent - reserved")
    void available() {
        Budget b = budget("10000", "2000", "1500");
        assertThat(b.available()).isEqualByComparingTo("6500");
        assertThat(b.hasAvailable(new BigDecimal("6500"))).isTrue();
        assertThat(b.hasAvailable(new BigDecimal("6500.01"))).isFalse();
    }

    @Test
    @DisplayName("consume moves the amount from reserved to spent")
    void consume() {
        Budget b = budget("10000", "2000", "5000");
        b.consume(new BigDecimal("5000"));
        assertThat(b.getReserved()).isEqualByComparingTo("0");
        assertThat(b.getSpent()).isEqualByComparingTo("7000");
    }

    @Test
    @DisplayName("Reserving past the allocation violates the invariant")
    void overReserveThrows() {
        Budget b = budget("10000", "2000", "7000");
        assertThatThrownBy(() -> b.reserve(new BigDecimal("1000.01")))
                .isInstanceOf(BudgetInvariantViolationException.class)
                .hasMessageContaining("ENG");
    }

    @Test
    @DisplayName("Releasing more than is reserved violates the invariant")
    void overReleaseThrows() {
        Budget b = budget("10000", "0", "100");
        assertThatThrownBy(() -> b.release(new BigDecimal("200")))
                .isInstanceOf(BudgetInvariantViolationException.class);
    }

    @Test
    @DisplayName("Utilization is spent over allocated, two decimals; zero allocation is 0%")
    void utilization() {
        assertThat(budget("30000", "10000", "0").utilizationPercent()).isEqualByComparingTo("33.33");
        assertThat(budget("0", "0", "0").utilizationPercent()).isEqualByComparingTo("0");
    }
}
