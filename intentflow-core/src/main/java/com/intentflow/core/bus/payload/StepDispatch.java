package com.intentflow.core.bus.payload;

import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;

import java.time.Duration;
import java.util.UUID;

/**
 * STEP_DISPATCH payload: run one attempt of a step (or its compensation).
 */
public record StepDispatch(
    UUID taskId,
    UUID planId,
    String stepId,
    int attempt,
    StepKind kind,
    ActionDescriptor action,
    String roleScope,
    Duration timeout,
    long fenceToken
) {
    public String dedupKey() {
        return StepResult.dedupKey(taskId, stepId, attempt, kind);
    }
}
