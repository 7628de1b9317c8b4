package com.intentflow.engine.execution;

import com.intentflow.core.model.TaskFailure;
import com.intentflow.core.model.TaskStatus;

import java.util.UUID;

/**
 * Where a task's execution stands after the engine handled an event.
 *
 * @param status Status the task should be in now
 * @param failure Summary once the execution ended in FAILED or CANCELLED
 * @param ignored True when the event was a duplicate or stale and changed nothing
 */
public record ExecutionProgress(
    UUID taskId,
    TaskStatus status,
    TaskFailure failure,
    boolean ignored
) {
    static ExecutionProgress ignored(UUID taskId, TaskStatus status) {
        return new ExecutionProgress(taskId, status, null, true);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
