package com.intentflow.core.exception;

/**
 * Thrown when the security gate rejects a plan outright.
 */
public class RiskExceededException extends OrchestratorException {

    public static final String ERROR_CODE = "RISK_EXCEEDED";

    public RiskExceededException(double riskScore, double highThreshold) {
        super(ERROR_CODE, String.format(
            "Plan risk %.3f is at or above the rejection threshold %.3f",
            riskScore, highThreshold
        ));
    }
}
