package com.intentflow.core.bus;

/**
 * Tag of every message exchanged between agents. Handlers switch on it to pick
 * the state machine transition a message triggers.
 */
public enum MessageType {
    TASK_REQUEST,
    PLAN_PROPOSED,
    SECURITY_DECISION,
    STEP_DISPATCH,
    STEP_RESULT,
    MEMORY_QUERY,
    MEMORY_RESULT,
    FEEDBACK,
    CANCEL,
    /** Backoff of a failed step elapsed; internal to the orchestrator. */
    RETRY_DUE
}
