package com.intentflow.core.model;

import java.time.Duration;

/**
 * Action categories understood by planning, the security gate and the capability registry.
 * Each category carries its preliminary risk class, whether it changes state outside
 * the assistant, and a default duration estimate.
 */
public enum ActionCategory {
    READ(RiskLevel.LOW, false, Duration.ofSeconds(2)),
    OPEN(RiskLevel.LOW, false, Duration.ofSeconds(3)),
    COMPUTE(RiskLevel.LOW, false, Duration.ofSeconds(5)),
    COMMUNICATE(RiskLevel.MEDIUM, true, Duration.ofSeconds(10)),
    WRITE_SYSTEM_STATE(RiskLevel.MEDIUM, true, Duration.ofSeconds(10)),
    DELETE(RiskLevel.HIGH, true, Duration.ofSeconds(5)),
    FINANCIAL_TRANSACTION(RiskLevel.HIGH, true, Duration.ofSeconds(15));

    private final RiskLevel riskLevel;
    private final boolean sideEffects;
    private final Duration defaultDuration;

    ActionCategory(RiskLevel riskLevel, boolean sideEffects, Duration defaultDuration) {
        this.riskLevel = riskLevel;
        this.sideEffects = sideEffects;
        this.defaultDuration = defaultDuration;
    }

    public RiskLevel riskLevel() {
        return riskLevel;
    }

    public boolean hasSideEffects() {
        return sideEffects;
    }

    public Duration defaultDuration() {
        return defaultDuration;
    }
}
