package com.intentflow.learning;

import com.intentflow.bus.InMemoryMessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageType;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.health.HealthStatus;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.DataSensitivity;
import com.intentflow.core.model.FeedbackRecord;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.test.TimeController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LearningAgentTest {

    private final MessageCodec codec = new MessageCodec();
    private final TimeController clock = TimeController.frozen();
    private InMemoryMessageBus bus;
    private LearningService learning;
    private LearningAgent agent;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus(2, 3);
        learning = new LearningService(new LearningService.Settings(0.2, Duration.ZERO, 0.0, 1.0), clock);
        agent = new LearningAgent(bus, codec, learning, clock);
        agent.start();
    }

    @AfterEach
    void tearDown() {
        agent.stop();
        bus.close();
    }

    @Test
    @DisplayName("Step results and feedback from the bus reach the learner")
    void consumesBusMessages() {
        UUID taskId = UUID.randomUUID();
        ActionDescriptor delete = ActionDescriptor.of(ActionCategory.DELETE, "delete_file", "old.log");
        StepResult result = StepResult.failure(taskId, UUID.randomUUID(), "s1", 1, StepKind.FORWARD,
            "LOCKED", "file in use", true, 30, clock.instant());

        bus.publish(Topics.STEP_RESULTS, MessageEnvelope.create(Topics.EXECUTION, Topics.ORCHESTRATOR,
            MessageType.STEP_RESULT, codec.toPayload(new StepResultMessage(result, delete, "alice")), 3,
            taskId.toString(), clock.instant()));
        assertThat(bus.awaitIdle(Duration.ofSeconds(5))).isTrue();
        bus.publish(Topics.FEEDBACK, MessageEnvelope.create(Topics.API, Topics.LEARNING, MessageType.FEEDBACK,
            codec.toPayload(new FeedbackRecord(taskId, 5, "fine", clock.instant())), 3,
            taskId.toString(), clock.instant()));

        assertThat(bus.awaitIdle(Duration.ofSeconds(5))).isTrue();
        // 0.2 after the failure, then pulled back by the good rating
        assertThat(learning.historicalSignal(ActionCategory.DELETE, DataSensitivity.INTERNAL))
            .isCloseTo(0.16, within(1e-9));
        assertThat(learning.feedback()).hasSize(1);
        assertThat(agent.health().status()).isEqualTo(HealthStatus.OK);
    }

    @Test
    @DisplayName("Stopped agent reports down")
    void stoppedAgentIsDown() {
        agent.stop();

        assertThat(agent.health().status()).isEqualTo(HealthStatus.DOWN);
    }
}
