package com.intentflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of one attempt of one step. Append-only.
 *
 * The deduplication key {@code taskId:stepId:attempt} identifies a result; compensation
 * results carry a distinct suffix so they never collide with the forward attempt.
 */
public record StepResult(
    UUID taskId,
    UUID planId,
    String stepId,
    int attempt,
    StepKind kind,
    StepOutcome outcome,
    JsonNode output,
    String errorCode,
    String errorMessage,
    boolean retryable,
    long durationMs,
    Instant timestamp
) {
    public StepResult {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(outcome, "outcome");
        kind = kind != null ? kind : StepKind.FORWARD;
    }

    public static String dedupKey(UUID taskId, String stepId, int attempt, StepKind kind) {
        String key = taskId + ":" + stepId + ":" + attempt;
        return kind == StepKind.COMPENSATION ? key + ":compensation" : key;
    }

    public String dedupKey() {
        return dedupKey(taskId, stepId, attempt, kind);
    }

    public boolean isSuccess() {
        return outcome == StepOutcome.SUCCESS;
    }

    public static StepResult success(UUID taskId, UUID planId, String stepId, int attempt,
                                     StepKind kind, JsonNode output, long durationMs, Instant timestamp) {
        return new StepResult(taskId, planId, stepId, attempt, kind, StepOutcome.SUCCESS,
            output, null, null, false, durationMs, timestamp);
    }

    public static StepResult failure(UUID taskId, UUID planId, String stepId, int attempt, StepKind kind,
                                     String errorCode, String errorMessage, boolean retryable,
                                     long durationMs, Instant timestamp) {
        return new StepResult(taskId, planId, stepId, attempt, kind, StepOutcome.FAILED,
            null, errorCode, errorMessage, retryable, durationMs, timestamp);
    }

    public static StepResult timeout(UUID taskId, UUID planId, String stepId, int attempt,
                                     StepKind kind, long durationMs, Instant timestamp) {
        return new StepResult(taskId, planId, stepId, attempt, kind, StepOutcome.TIMEOUT,
            null, "STEP_TIMEOUT", "Step did not finish within its timeout", true, durationMs, timestamp);
    }
}
