package com.intentflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Effect-producing collaborator for one kind of action.
 * Implement this interface to drive an application, a script runner or a remote tool.
 *
 * The same executor handles forward actions and compensations; check
 * {@link StepContext#isCompensation()} where the two differ.
 */
@FunctionalInterface
public interface StepExecutor {

    /**
     * Execute one attempt of a step.
     *
     * @param context Dispatch details and helpers
     * @return Output to record on the step result
     * @throws StepExecutionException if the action fails
     */
    JsonNode execute(StepContext context) throws StepExecutionException;
}
