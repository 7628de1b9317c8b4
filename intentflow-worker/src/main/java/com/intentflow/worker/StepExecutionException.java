package com.intentflow.worker;

/**
 * Thrown by step executors on failure. Non-retryable failures skip the remaining attempts.
 */
public class StepExecutionException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public StepExecutionException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public StepExecutionException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public StepExecutionException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static StepExecutionException permanent(String errorCode, String message) {
        return new StepExecutionException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static StepExecutionException transient_(String errorCode, String message) {
        return new StepExecutionException(errorCode, message, true);
    }
}
