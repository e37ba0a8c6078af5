package com.procureflow.engine.supplier;

public enum RiskScore {
    LOW,
    MEDIUM,
    HIGH
}
