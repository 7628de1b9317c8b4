package com.intentflow.core.exception;

import java.util.UUID;

/**
 * Thrown when a task with the same id already exists.
 */
public class DuplicateTaskException extends OrchestratorException {

    public static final String ERROR_CODE = "DUPLICATE_TASK";

    public DuplicateTaskException(UUID taskId) {
        super(ERROR_CODE, String.format(
            "Task already exists: %s",
            taskId
        ));
    }
}
