package com.intentflow.core.exception;

/**
 * Thrown when a concurrent update is detected.
 */
public class OptimisticLockException extends OrchestratorException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK";

    public OptimisticLockException(String entityType, String entityId, long expectedVersion) {
        super(ERROR_CODE, String.format(
            "Concurrent update of %s %s (expected version %d)",
            entityType, entityId, expectedVersion
        ));
    }
}
