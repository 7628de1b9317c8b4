package com.intentflow.core.bus.payload;

import java.util.UUID;

/**
 * RETRY_DUE payload: the next attempt of a step may be dispatched.
 */
public record RetryDue(UUID taskId, String stepId, int attempt) {
}
