package com.intentflow.engine.security;

/**
 * Decision boundaries of the security gate.
 * Risk below {@code low} is approved automatically, risk at or above {@code high} is rejected,
 * anything in between waits for a human confirmation.
 */
public record RiskThresholds(double low, double high) {

    public RiskThresholds {
        if (low < 0.0 || high > 1.0 || low >= high) {
            throw new IllegalArgumentException(String.format(
                "Thresholds must satisfy 0 <= low < high <= 1, got low=%s high=%s", low, high));
        }
    }

    public static RiskThresholds defaults() {
        return new RiskThresholds(0.30, 0.80);
    }
}
