package com.intentflow.core.bus.payload;

import com.intentflow.core.model.Plan;

/**
 * PLAN_PROPOSED payload.
 */
public record PlanProposed(
    Plan plan,
    String intent,
    String roleScope
) {
}
