package com.intentflow.core.exception;

import java.util.Collection;

/**
 * Thrown when the steps of a plan depend on each other in a cycle.
 */
public class PlanCycleException extends OrchestratorException {

    public static final String ERROR_CODE = "PLAN_CYCLE";

    public PlanCycleException(Collection<String> stepsInCycle) {
        super(ERROR_CODE, String.format(
            "Plan has cyclic dependencies between steps %s",
            stepsInCycle
        ));
    }
}
