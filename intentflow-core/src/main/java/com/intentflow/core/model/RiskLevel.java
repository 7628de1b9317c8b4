package com.intentflow.core.model;

/**
 * Preliminary risk classification assigned at planning time from the action category.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
