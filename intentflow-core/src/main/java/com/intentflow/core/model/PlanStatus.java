package com.intentflow.core.model;

/**
 * Lifecycle of one plan version.
 */
public enum PlanStatus {
    PROPOSED,
    ACCEPTED,
    RUNNING,
    SUPERSEDED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == SUPERSEDED || this == COMPLETED || this == FAILED;
    }
}
