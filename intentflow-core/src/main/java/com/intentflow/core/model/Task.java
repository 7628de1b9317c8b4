package com.intentflow.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One user intent and its lifecycle.
 *
 * Invariants:
 * - exactly one live instance per taskId
 * - correlationId equals taskId for every message of this task
 * - status only moves along {@link TaskStatus#canTransitionTo}
 * - version increases on every persisted update (optimistic locking)
 */
public record Task(
    UUID taskId,
    String intent,
    String roleScope,
    int priority,
    TaskStatus status,
    String correlationId,
    UUID currentPlanId,
    int planVersion,
    boolean cancelRequested,
    TaskFailure failure,
    long fenceToken,
    long version,
    Instant createdAt,
    Instant updatedAt
) {
    public static final int DEFAULT_PRIORITY = 3;

    public Task {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(status, "status");
        correlationId = correlationId != null ? correlationId : taskId.toString();
    }

    public static Task create(UUID taskId, String intent, String roleScope, int priority, Instant now) {
        return new Task(taskId, intent, roleScope, priority, TaskStatus.PENDING, taskId.toString(),
            null, 0, false, null, 0L, 0L, now, now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Task withStatus(TaskStatus newStatus, Instant now) {
        return new Task(taskId, intent, roleScope, priority, newStatus, correlationId, currentPlanId,
            planVersion, cancelRequested, failure, fenceToken, version, createdAt, now);
    }

    public Task withPlan(UUID planId, int planVersion, Instant now) {
        return new Task(taskId, intent, roleScope, priority, status, correlationId, planId,
            planVersion, cancelRequested, failure, fenceToken, version, createdAt, now);
    }

    public Task withFailure(TaskStatus terminalStatus, TaskFailure taskFailure, Instant now) {
        return new Task(taskId, intent, roleScope, priority, terminalStatus, correlationId, currentPlanId,
            planVersion, cancelRequested, taskFailure, fenceToken, version, createdAt, now);
    }

    public Task withCancelRequested(Instant now) {
        return new Task(taskId, intent, roleScope, priority, status, correlationId, currentPlanId,
            planVersion, true, failure, fenceToken, version, createdAt, now);
    }

    public Task withFenceToken(long token) {
        return new Task(taskId, intent, roleScope, priority, status, correlationId, currentPlanId,
            planVersion, cancelRequested, failure, token, version, createdAt, updatedAt);
    }

    public Task withVersion(long newVersion) {
        return new Task(taskId, intent, roleScope, priority, status, correlationId, currentPlanId,
            planVersion, cancelRequested, failure, fenceToken, newVersion, createdAt, updatedAt);
    }
}
