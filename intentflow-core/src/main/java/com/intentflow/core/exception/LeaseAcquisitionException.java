package com.intentflow.core.exception;

/**
 * Thrown when the per-task lease is held by another orchestrator instance.
 */
public class LeaseAcquisitionException extends OrchestratorException {

    public static final String ERROR_CODE = "LEASE_NOT_ACQUIRED";

    public LeaseAcquisitionException(String leaseKey, String reason) {
        super(ERROR_CODE, String.format(
            "Could not acquire lease %s: %s",
            leaseKey, reason
        ));
    }
}
