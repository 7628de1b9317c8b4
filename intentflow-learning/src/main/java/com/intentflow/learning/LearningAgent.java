package com.intentflow.learning;

import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageType;
import com.intentflow.core.bus.Subscription;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.health.AgentHealth;
import com.intentflow.core.health.AgentLiveness;
import com.intentflow.core.health.HealthReporter;
import com.intentflow.core.logging.LoggingContext;
import com.intentflow.core.model.FeedbackRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Feeds STEP_RESULT and FEEDBACK messages into the {@link LearningService}.
 */
public class LearningAgent implements HealthReporter {

    private static final Logger log = LoggerFactory.getLogger(LearningAgent.class);

    private final MessageBus bus;
    private final MessageCodec codec;
    private final LearningService learning;
    private final AgentLiveness liveness;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public LearningAgent(MessageBus bus, MessageCodec codec, LearningService learning, Clock clock) {
        this.bus = bus;
        this.codec = codec;
        this.learning = learning;
        this.liveness = new AgentLiveness(Topics.LEARNING, clock);
    }

    public synchronized void start() {
        subscriptions.add(bus.subscribe(Topics.STEP_RESULTS, Topics.LEARNING, this::onStepResult));
        subscriptions.add(bus.subscribe(Topics.FEEDBACK, Topics.LEARNING, this::onFeedback));
        liveness.started();
        log.info("Learning agent started");
    }

    public synchronized void stop() {
        subscriptions.forEach(Subscription::close);
        subscriptions.clear();
        liveness.stopped();
        log.info("Learning agent stopped");
    }

    @Override
    public AgentHealth health() {
        return liveness.health();
    }

    void onStepResult(MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.STEP_RESULT) {
            return;
        }
        try (LoggingContext ctx = LoggingContext.forAgent(Topics.LEARNING, envelope.correlationId())) {
            learning.recordStepResult(codec.fromPayload(envelope, StepResultMessage.class));
            liveness.processed();
        } catch (RuntimeException e) {
            liveness.failed(e);
            throw e;
        }
    }

    void onFeedback(MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.FEEDBACK) {
            return;
        }
        try (LoggingContext ctx = LoggingContext.forAgent(Topics.LEARNING, envelope.correlationId())) {
            FeedbackRecord record = codec.fromPayload(envelope, FeedbackRecord.class);
            learning.recordFeedback(record);
            log.info("Recorded feedback {} for task {}", record.humanRating(), record.taskId());
            liveness.processed();
        } catch (RuntimeException e) {
            liveness.failed(e);
            throw e;
        }
    }
}
