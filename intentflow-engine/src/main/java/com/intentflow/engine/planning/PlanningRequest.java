package com.intentflow.engine.planning;

import java.util.UUID;

/**
 * Input to one planning round. {@code previousPlanId} is set when replanning.
 */
public record PlanningRequest(
    UUID taskId,
    String intent,
    String roleScope,
    int version,
    UUID previousPlanId
) {
    public static PlanningRequest initial(UUID taskId, String intent, String roleScope) {
        return new PlanningRequest(taskId, intent, roleScope, 1, null);
    }
}
