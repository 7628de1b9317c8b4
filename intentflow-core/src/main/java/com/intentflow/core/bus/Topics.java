package com.intentflow.core.bus;

/**
 * Topic names and agent ids used across modules.
 */
public final class Topics {

    /** TASK_REQUEST, CANCEL, RETRY_DUE for the orchestrator. */
    public static final String TASKS = "intentflow.tasks";
    /** STEP_DISPATCH for execution agents. */
    public static final String STEP_DISPATCH = "intentflow.step-dispatch";
    /** STEP_RESULT, consumed by the orchestrator, memory and learning. */
    public static final String STEP_RESULTS = "intentflow.step-results";
    /** PLAN_PROPOSED and SECURITY_DECISION notifications. */
    public static final String TASK_EVENTS = "intentflow.task-events";
    /** MEMORY_QUERY for the memory agent. */
    public static final String MEMORY_QUERIES = "intentflow.memory-queries";
    /** MEMORY_RESULT replies. */
    public static final String MEMORY_RESULTS = "intentflow.memory-results";
    /** FEEDBACK for the learning agent. */
    public static final String FEEDBACK = "intentflow.feedback";

    public static final String ORCHESTRATOR = "orchestrator";
    public static final String EXECUTION = "execution";
    public static final String MEMORY = "memory";
    public static final String LEARNING = "learning";
    public static final String PLANNING = "planning";
    public static final String SECURITY_GATE = "security-gate";
    public static final String API = "api";

    private Topics() {
    }
}
