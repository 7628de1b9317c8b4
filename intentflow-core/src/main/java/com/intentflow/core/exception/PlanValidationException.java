package com.intentflow.core.exception;

/**
 * Thrown when a plan fails structural validation.
 */
public class PlanValidationException extends OrchestratorException {

    public static final String ERROR_CODE = "PLAN_INVALID";

    public PlanValidationException(String field, String reason) {
        super(ERROR_CODE, String.format(
            "Invalid plan - %s: %s",
            field, reason
        ));
    }
}
