package com.intentflow.core.exception;

import com.intentflow.core.model.TaskStatus;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(TaskStatus currentState, TaskStatus targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentState, targetState
        ));
    }

    public InvalidStateTransitionException(String entityType, String currentState, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot %s %s in state %s",
            operation, entityType, currentState
        ));
    }
}
