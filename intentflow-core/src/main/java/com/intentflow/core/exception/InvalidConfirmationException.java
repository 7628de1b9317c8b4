package com.intentflow.core.exception;

import java.util.UUID;

/**
 * Thrown when a confirmation token is unknown, already used or issued for another task.
 */
public class InvalidConfirmationException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_CONFIRMATION";

    public InvalidConfirmationException(UUID taskId, String reason) {
        super(ERROR_CODE, String.format(
            "Invalid confirmation for task %s: %s",
            taskId, reason
        ));
    }
}
