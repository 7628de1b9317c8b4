package com.intentflow.engine.execution;

import com.intentflow.core.bus.payload.RetryDue;
import com.intentflow.core.bus.payload.StepDispatch;

import java.time.Duration;

/**
 * Outbound side of the execution engine.
 */
public interface StepDispatcher {

    /**
     * Hand one attempt of a step (or its compensation) to the execution agents.
     */
    void dispatch(StepDispatch dispatch, int priority);

    /**
     * Deliver a RETRY_DUE back to the orchestrator once the backoff has elapsed.
     */
    void scheduleRetry(RetryDue due, int priority, Duration delay);
}
