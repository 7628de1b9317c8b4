package com.intentflow.engine.memory;

import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageType;
import com.intentflow.core.bus.Subscription;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.MemoryQuery;
import com.intentflow.core.bus.payload.MemoryResult;
import com.intentflow.core.bus.payload.PlanProposed;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.health.AgentHealth;
import com.intentflow.core.health.AgentLiveness;
import com.intentflow.core.health.HealthReporter;
import com.intentflow.core.logging.LoggingContext;
import com.intentflow.core.model.RankedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Bus front of the {@link MemoryStore}: answers MEMORY_QUERY messages and ingests step
 * results and proposed plans.
 */
public class MemoryAgent implements HealthReporter {

    private static final Logger log = LoggerFactory.getLogger(MemoryAgent.class);

    private final MessageBus bus;
    private final MessageCodec codec;
    private final MemoryStore store;
    private final Clock clock;
    private final AgentLiveness liveness;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public MemoryAgent(MessageBus bus, MessageCodec codec, MemoryStore store, Clock clock) {
        this.bus = bus;
        this.codec = codec;
        this.store = store;
        this.clock = clock;
        this.liveness = new AgentLiveness(Topics.MEMORY, clock);
    }

    public synchronized void start() {
        subscriptions.add(bus.subscribe(Topics.MEMORY_QUERIES, Topics.MEMORY, this::onQuery));
        subscriptions.add(bus.subscribe(Topics.STEP_RESULTS, Topics.MEMORY, this::onStepResult));
        subscriptions.add(bus.subscribe(Topics.TASK_EVENTS, Topics.MEMORY, this::onTaskEvent));
        liveness.started();
        log.info("Memory agent started");
    }

    public synchronized void stop() {
        subscriptions.forEach(Subscription::close);
        subscriptions.clear();
        liveness.stopped();
        log.info("Memory agent stopped");
    }

    @Override
    public AgentHealth health() {
        return liveness.health();
    }

    void onQuery(MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.MEMORY_QUERY) {
            return;
        }
        MemoryQuery query = codec.fromPayload(envelope, MemoryQuery.class);
        MemoryResult result;
        try (LoggingContext ctx = LoggingContext.forAgent(Topics.MEMORY, envelope.correlationId())) {
            try {
                List<RankedContext> entries = store.retrieveContext(query.roleScope(), query.queryTerms(),
                    query.limit());
                result = new MemoryResult(query.requestId(), entries, true);
                liveness.processed();
            } catch (RuntimeException e) {
                log.error("Memory query {} failed", query.requestId(), e);
                liveness.failed(e);
                result = new MemoryResult(query.requestId(), List.of(), false);
            }
            bus.publish(query.replyTopic(), MessageEnvelope.create(Topics.MEMORY, envelope.senderId(),
                MessageType.MEMORY_RESULT, codec.toPayload(result), envelope.priority(),
                envelope.correlationId(), clock.instant()));
        }
    }

    void onStepResult(MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.STEP_RESULT) {
            return;
        }
        try (LoggingContext ctx = LoggingContext.forAgent(Topics.MEMORY, envelope.correlationId())) {
            store.recordStepResult(codec.fromPayload(envelope, StepResultMessage.class));
            liveness.processed();
        } catch (RuntimeException e) {
            liveness.failed(e);
            throw e;
        }
    }

    void onTaskEvent(MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.PLAN_PROPOSED) {
            return;
        }
        try (LoggingContext ctx = LoggingContext.forAgent(Topics.MEMORY, envelope.correlationId())) {
            store.recordPlanProposal(codec.fromPayload(envelope, PlanProposed.class));
            liveness.processed();
        } catch (RuntimeException e) {
            liveness.failed(e);
            throw e;
        }
    }
}
