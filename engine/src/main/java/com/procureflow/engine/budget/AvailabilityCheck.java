package com.procureflow.engine.budget;

import java.math.BigDecimal;

import lombok.Value;

@Value
public class AvailabilityCheck {
    String departmentId;
    BigDecimal requested;
    BigDecimal available;
    boolean sufficient;
}
