package com.intentflow.core.exception;

import java.util.UUID;

/**
 * Thrown when a confirmation token expired before it was redeemed.
 */
public class ConfirmationTimeoutException extends OrchestratorException {

    public static final String ERROR_CODE = "CONFIRMATION_TIMEOUT";

    public ConfirmationTimeoutException(UUID taskId) {
        super(ERROR_CODE, String.format(
            "Confirmation window for task %s has expired",
            taskId
        ));
    }
}
