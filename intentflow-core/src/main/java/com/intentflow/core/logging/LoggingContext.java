package com.intentflow.core.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Ensures all logs include the task and step they belong to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep(taskId, stepId, attempt)) {
 *     log.info("Dispatching step"); // includes taskId, stepId, attempt
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String PLAN_ID = "planId";
    public static final String STEP_ID = "stepId";
    public static final String ATTEMPT = "attempt";
    public static final String CORRELATION_ID = "correlationId";
    public static final String AGENT_ID = "agentId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Create a logging context for task-level operations.
     */
    public static LoggingContext forTask(UUID taskId) {
        return forTask(taskId, null);
    }

    public static LoggingContext forTask(UUID taskId, UUID planId) {
        LoggingContext ctx = new LoggingContext();
        if (taskId != null) {
            MDC.put(TASK_ID, taskId.toString());
            MDC.put(CORRELATION_ID, taskId.toString());
        }
        if (planId != null) {
            MDC.put(PLAN_ID, planId.toString());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a single step attempt.
     */
    public static LoggingContext forStep(UUID taskId, String stepId, int attempt) {
        LoggingContext ctx = forTask(taskId);
        if (stepId != null) {
            MDC.put(STEP_ID, stepId);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Create a logging context for an agent handling a bus message.
     */
    public static LoggingContext forAgent(String agentId, String correlationId) {
        LoggingContext ctx = new LoggingContext();
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        }
        if (correlationId != null) {
            MDC.put(CORRELATION_ID, correlationId);
        }
        ensureTraceId();
        return ctx;
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(PLAN_ID);
        MDC.remove(STEP_ID);
        MDC.remove(ATTEMPT);
        MDC.remove(CORRELATION_ID);
        MDC.remove(AGENT_ID);
        // TRACE_ID stays for the rest of the request
    }

    /**
     * Clear all MDC context. Call at the end of a request or consumer loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
