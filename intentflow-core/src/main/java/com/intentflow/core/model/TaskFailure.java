package com.intentflow.core.model;

import java.util.List;

/**
 * Caller-visible summary of a terminal failure or cancellation.
 */
public record TaskFailure(
    FailureReason reason,
    String message,
    String stepId,
    Completeness completeness,
    List<RollbackFailure> rollbackFailures
) {
    public TaskFailure {
        completeness = completeness != null ? completeness : Completeness.NOT_REQUIRED;
        rollbackFailures = rollbackFailures != null ? List.copyOf(rollbackFailures) : List.of();
    }

    public static TaskFailure of(FailureReason reason, String message) {
        return new TaskFailure(reason, message, null, Completeness.NOT_REQUIRED, List.of());
    }

    public boolean compensationsSucceeded() {
        return completeness == Completeness.FULL || completeness == Completeness.NOT_REQUIRED;
    }
}
