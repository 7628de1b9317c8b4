package com.intentflow.core.exception;

/**
 * Thrown when the memory store cannot answer in time. Callers degrade to an empty context.
 */
public class MemoryUnavailableException extends OrchestratorException {

    public static final String ERROR_CODE = "MEMORY_UNAVAILABLE";

    public MemoryUnavailableException(String message) {
        super(ERROR_CODE, message);
    }

    public MemoryUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
