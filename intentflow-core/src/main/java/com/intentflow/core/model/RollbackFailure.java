package com.intentflow.core.model;

import java.time.Instant;

/**
 * A compensating action that did not succeed. Recorded, never fatal on its own.
 */
public record RollbackFailure(
    String stepId,
    String errorCode,
    String message,
    Instant timestamp
) {
}
