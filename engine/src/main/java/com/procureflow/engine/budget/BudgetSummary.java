package com.procureflow.engine.budget;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BudgetSummary {
    String departmentId;
    String departmentName;
    int fiscalYear;
    BigDecimal allocated;
    BigDecimal spent;
    BigDecimal reserved;
    BigDecimal available;
    BigDecimal utilizationPercent;
    String managerEmail;

    static BudgetSummary of(Budget budget) {
        return BudgetSummary.builder()
                .departmentId(budget.getDepartmentId())
                .departmentName(budget.getDepartmentName())
                .fiscalYear(budget.getFiscalYear())
                .allocated(budget.getAllocated())
                .spent(budget.getSpent())
                .reserved(budget.getReserved())
                .available(budget.available())
                .utilizationPercent(budget.utilizationPercent())
                .managerEmail(budget.getManagerEmail())
                .build();
    }
}
