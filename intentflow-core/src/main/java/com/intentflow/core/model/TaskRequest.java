package com.intentflow.core.model;

import java.util.UUID;

/**
 * A user intent to be turned into a task. {@code taskId} is optional; when present,
 * resubmitting the same request resolves to the same task.
 */
public record TaskRequest(
    UUID taskId,
    String intent,
    String roleScope,
    int priority
) {
    public static final String DEFAULT_ROLE_SCOPE = "default";

    public TaskRequest {
        if (intent == null || intent.isBlank()) {
            throw new IllegalArgumentException("intent must not be blank");
        }
        roleScope = roleScope == null || roleScope.isBlank() ? DEFAULT_ROLE_SCOPE : roleScope;
        priority = priority < 1 || priority > 5 ? Task.DEFAULT_PRIORITY : priority;
    }

    public static TaskRequest of(String intent, String roleScope) {
        return new TaskRequest(null, intent, roleScope, Task.DEFAULT_PRIORITY);
    }
}
