package com.intentflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentflow.core.bus.payload.StepDispatch;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.StepKind;

import java.util.UUID;

/**
 * Context provided to step executors during execution.
 */
public class StepContext {

    private final StepDispatch dispatch;
    private final ObjectMapper objectMapper;

    public StepContext(StepDispatch dispatch, ObjectMapper objectMapper) {
        this.dispatch = dispatch;
        this.objectMapper = objectMapper;
    }

    public StepDispatch getDispatch() {
        return dispatch;
    }

    /**
     * The action to perform; for a compensation this is the compensating action.
     */
    public ActionDescriptor getAction() {
        return dispatch.action();
    }

    /**
     * Look up an action parameter.
     */
    public String getParameter(String name) {
        return dispatch.action().parameters().get(name);
    }

    public UUID getTaskId() {
        return dispatch.taskId();
    }

    public String getStepId() {
        return dispatch.stepId();
    }

    public int getAttemptNumber() {
        return dispatch.attempt();
    }

    public String getRoleScope() {
        return dispatch.roleScope();
    }

    public boolean isCompensation() {
        return dispatch.kind() == StepKind.COMPENSATION;
    }

    /**
     * Get the idempotency key for this attempt.
     * Pass it along to external systems so a redelivered dispatch is not applied twice.
     */
    public String getIdempotencyKey() {
        return dispatch.dedupKey();
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }
}
