package com.intentflow.engine.coordinator;

import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.Subscription;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.CancelRequest;
import com.intentflow.core.bus.payload.RetryDue;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.exception.OrchestratorException;
import com.intentflow.core.health.AgentHealth;
import com.intentflow.core.health.AgentLiveness;
import com.intentflow.core.health.HealthReporter;
import com.intentflow.core.logging.LoggingContext;
import com.intentflow.core.model.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Bus front of the {@link TaskOrchestrator}.
 *
 * Domain errors raised while handling a message are final for that message (the task
 * already records them) and are not redelivered; anything else is rethrown so the bus
 * delivers the message again.
 */
public class OrchestratorAgent implements HealthReporter {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorAgent.class);

    private final MessageBus bus;
    private final MessageCodec codec;
    private final TaskOrchestrator orchestrator;
    private final AgentLiveness liveness;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public OrchestratorAgent(MessageBus bus, MessageCodec codec, TaskOrchestrator orchestrator, Clock clock) {
        this.bus = bus;
        this.codec = codec;
        this.orchestrator = orchestrator;
        this.liveness = new AgentLiveness(Topics.ORCHESTRATOR, clock);
    }

    public synchronized void start() {
        subscriptions.add(bus.subscribe(Topics.TASKS, Topics.ORCHESTRATOR, this::onTaskMessage));
        subscriptions.add(bus.subscribe(Topics.STEP_RESULTS, Topics.ORCHESTRATOR, this::onStepResult));
        liveness.started();
        log.info("Orchestrator agent started");
    }

    public synchronized void stop() {
        subscriptions.forEach(Subscription::close);
        subscriptions.clear();
        liveness.stopped();
        log.info("Orchestrator agent stopped");
    }

    @Override
    public AgentHealth health() {
        return liveness.health();
    }

    void onTaskMessage(MessageEnvelope envelope) {
        try (LoggingContext ctx = LoggingContext.forAgent(Topics.ORCHESTRATOR, envelope.correlationId())) {
            switch (envelope.messageType()) {
                case TASK_REQUEST -> orchestrator.submitTask(codec.fromPayload(envelope, TaskRequest.class));
                case CANCEL -> {
                    CancelRequest cancel = codec.fromPayload(envelope, CancelRequest.class);
                    orchestrator.cancel(cancel.taskId(), cancel.reason());
                }
                case RETRY_DUE -> orchestrator.onRetryDue(codec.fromPayload(envelope, RetryDue.class));
                default -> log.debug("Ignoring {} on task topic", envelope.messageType());
            }
            liveness.processed();
        } catch (OrchestratorException e) {
            log.warn("{} for {} ended with {}: {}", envelope.messageType(), envelope.correlationId(),
                e.getErrorCode(), e.getMessage());
            liveness.processed();
        } catch (RuntimeException e) {
            liveness.failed(e);
            throw e;
        }
    }

    void onStepResult(MessageEnvelope envelope) {
        try (LoggingContext ctx = LoggingContext.forAgent(Topics.ORCHESTRATOR, envelope.correlationId())) {
            orchestrator.onStepResult(codec.fromPayload(envelope, StepResultMessage.class));
            liveness.processed();
        } catch (OrchestratorException e) {
            log.warn("Result for {} ended with {}: {}", envelope.correlationId(), e.getErrorCode(), e.getMessage());
            liveness.processed();
        } catch (RuntimeException e) {
            liveness.failed(e);
            throw e;
        }
    }
}
