package com.intentflow.core.bus.payload;

import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.StepResult;

/**
 * STEP_RESULT payload: the result plus what was executed, so memory and learning
 * can attribute it without reading the plan.
 */
public record StepResultMessage(
    StepResult result,
    ActionDescriptor action,
    String roleScope
) {
}
