package com.intentflow.engine.execution;

import java.time.Duration;

/**
 * Execution limits.
 *
 * @param concurrencyLimit Maximum parallel-safe steps of one task in flight at once
 * @param stepTimeout Time an executor gets for one attempt
 */
public record ExecutionSettings(int concurrencyLimit, Duration stepTimeout) {

    public ExecutionSettings {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1");
        }
        if (stepTimeout == null || stepTimeout.isNegative() || stepTimeout.isZero()) {
            throw new IllegalArgumentException("stepTimeout must be positive");
        }
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(4, Duration.ofMinutes(2));
    }
}
