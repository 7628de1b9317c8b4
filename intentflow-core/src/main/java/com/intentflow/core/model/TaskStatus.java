package com.intentflow.core.model;

/**
 * Lifecycle states for a task.
 * Only the orchestrator mutates a task's status.
 */
public enum TaskStatus {
    /**
     * Task has been received but planning has not begun.
     * Transitions: -> PLANNING, FAILED, CANCELLED
     */
    PENDING,

    /**
     * Intent is being decomposed into a plan.
     * Transitions: -> AWAITING_CONFIRMATION, RUNNING, FAILED, CANCELLED
     */
    PLANNING,

    /**
     * Plan was gated and waits for a human confirmation token.
     * Transitions: -> RUNNING, FAILED, CANCELLED
     */
    AWAITING_CONFIRMATION,

    /**
     * Steps are being dispatched and their results applied.
     * Transitions: -> RETRYING, ROLLING_BACK, PLANNING, COMPLETED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * At least one step failed and waits for its backoff to elapse.
     * Transitions: -> RUNNING, ROLLING_BACK, PLANNING, FAILED, CANCELLED
     */
    RETRYING,

    /**
     * Compensating actions run in reverse completion order.
     * Transitions: -> PLANNING, FAILED, CANCELLED
     */
    ROLLING_BACK,

    /**
     * Every step succeeded. Terminal state.
     */
    COMPLETED,

    /**
     * Task failed. Terminal state.
     */
    FAILED,

    /**
     * Task was cancelled. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this state is terminal (no further transitions).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if steps may be in flight in this state.
     */
    public boolean isExecuting() {
        return this == RUNNING || this == RETRYING || this == ROLLING_BACK;
    }

    /**
     * Check if transition to target state is valid.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == PLANNING || target == FAILED || target == CANCELLED;
            case PLANNING -> target == AWAITING_CONFIRMATION || target == RUNNING
                || target == FAILED || target == CANCELLED;
            case AWAITING_CONFIRMATION -> target == RUNNING || target == FAILED || target == CANCELLED;
            case RUNNING -> target == RETRYING || target == ROLLING_BACK || target == PLANNING
                || target == COMPLETED || target == FAILED || target == CANCELLED;
            case RETRYING -> target == RUNNING || target == ROLLING_BACK || target == PLANNING
                || target == FAILED || target == CANCELLED;
            case ROLLING_BACK -> target == PLANNING || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
