package com.intentflow.core.exception;

/**
 * Thrown when a side-effecting step at MEDIUM risk or above has no compensating action.
 */
public class MissingCompensationException extends OrchestratorException {

    public static final String ERROR_CODE = "MISSING_COMPENSATION";

    public MissingCompensationException(String stepId, String actionName) {
        super(ERROR_CODE, String.format(
            "Step %s (%s) has side effects but no compensating action",
            stepId, actionName
        ));
    }
}
