package com.intentflow.engine.execution;

import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageType;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.RetryDue;
import com.intentflow.core.bus.payload.StepDispatch;

import java.time.Clock;
import java.time.Duration;

/**
 * Publishes dispatches on the step-dispatch topic and retry timers on the task topic.
 */
public class BusStepDispatcher implements StepDispatcher {

    private final MessageBus bus;
    private final MessageCodec codec;
    private final Clock clock;

    public BusStepDispatcher(MessageBus bus, MessageCodec codec, Clock clock) {
        this.bus = bus;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public void dispatch(StepDispatch dispatch, int priority) {
        bus.publish(Topics.STEP_DISPATCH, MessageEnvelope.create(Topics.ORCHESTRATOR, Topics.EXECUTION,
            MessageType.STEP_DISPATCH, codec.toPayload(dispatch), priority,
            dispatch.taskId().toString(), clock.instant()));
    }

    @Override
    public void scheduleRetry(RetryDue due, int priority, Duration delay) {
        bus.publishDelayed(Topics.TASKS, MessageEnvelope.create(Topics.ORCHESTRATOR, Topics.ORCHESTRATOR,
            MessageType.RETRY_DUE, codec.toPayload(due), priority,
            due.taskId().toString(), clock.instant()), delay);
    }
}
