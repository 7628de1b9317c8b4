package com.intentflow.worker;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.intentflow.bus.InMemoryMessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageType;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.StepDispatch;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepOutcome;
import com.intentflow.core.model.StepResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionAgentTest {

    private final MessageCodec codec = new MessageCodec();
    private final Clock clock = Clock.systemUTC();
    private InMemoryMessageBus bus;
    private ExecutorRegistry registry;
    private ExecutionAgent agent;
    private final List<StepResultMessage> results = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus(4, 3);
        registry = new ExecutorRegistry();
        agent = new ExecutionAgent(bus, codec, registry, clock, 4, 100);
        bus.subscribe(Topics.STEP_RESULTS, "test", envelope ->
            results.add(codec.fromPayload(envelope, StepResultMessage.class)));
        agent.start();
    }

    @AfterEach
    void tearDown() {
        agent.stop();
        bus.close();
    }

    private StepDispatch dispatch(UUID taskId, String stepId, int attempt, ActionDescriptor action, Duration timeout) {
        return new StepDispatch(taskId, UUID.randomUUID(), stepId, attempt, StepKind.FORWARD, action,
            "analyst", timeout, 1L);
    }

    private void send(StepDispatch dispatch) {
        bus.publish(Topics.STEP_DISPATCH, MessageEnvelope.create(Topics.ORCHESTRATOR, Topics.EXECUTION,
            MessageType.STEP_DISPATCH, codec.toPayload(dispatch), 3, dispatch.taskId().toString(), clock.instant()));
    }

    private void awaitResults(int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (results.size() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(results).hasSizeGreaterThanOrEqualTo(count);
    }

    // ========== Execution Tests ==========

    @Test
    @DisplayName("A successful executor produces a SUCCESS result carrying the action")
    void shouldPublishSuccessResult() throws Exception {
        registry.register(ActionCategory.OPEN, context ->
            context.toJsonNode(java.util.Map.of("opened", context.getAction().target())));
        ActionDescriptor action = ActionDescriptor.of(ActionCategory.OPEN, "open_file", "q3-report.pdf");

        send(dispatch(UUID.randomUUID(), "s1", 1, action, Duration.ofSeconds(5)));

        awaitResults(1);
        StepResult result = results.get(0).result();
        assertThat(result.outcome()).isEqualTo(StepOutcome.SUCCESS);
        assertThat(result.output().get("opened").asText()).isEqualTo("q3-report.pdf");
        assertThat(results.get(0).action()).isEqualTo(action);
        assertThat(results.get(0).roleScope()).isEqualTo("analyst");
    }

    @Test
    @DisplayName("Executor failures keep their error code and retryable flag")
    void shouldPublishFailureResult() throws Exception {
        registry.register(ActionCategory.COMMUNICATE, context -> {
            throw StepExecutionException.permanent("RECIPIENT_UNKNOWN", "no such contact");
        });

        send(dispatch(UUID.randomUUID(), "s1", 1,
            ActionDescriptor.of(ActionCategory.COMMUNICATE, "compose_email", "nobody"), Duration.ofSeconds(5)));

        awaitResults(1);
        StepResult result = results.get(0).result();
        assertThat(result.outcome()).isEqualTo(StepOutcome.FAILED);
        assertThat(result.errorCode()).isEqualTo("RECIPIENT_UNKNOWN");
        assertThat(result.retryable()).isFalse();
    }

    @Test
    @DisplayName("An action without executor fails permanently")
    void shouldFailWithoutExecutor() throws Exception {
        send(dispatch(UUID.randomUUID(), "s1", 1,
            ActionDescriptor.of(ActionCategory.DELETE, "delete_file", "a.txt"), Duration.ofSeconds(5)));

        awaitResults(1);
        assertThat(results.get(0).result().errorCode()).isEqualTo(ExecutionAgent.NO_EXECUTOR);
        assertThat(results.get(0).result().retryable()).isFalse();
    }

    @Test
    @DisplayName("A step exceeding its timeout yields a TIMEOUT result")
    void shouldTimeOutSlowStep() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        registry.register(ActionCategory.COMPUTE, context -> {
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return JsonNodeFactory.instance.nullNode();
        });

        send(dispatch(UUID.randomUUID(), "s1", 1,
            ActionDescriptor.of(ActionCategory.COMPUTE, "extract_summary", "doc"), Duration.ofMillis(100)));

        awaitResults(1);
        Thread.sleep(100);
        assertThat(results).hasSize(1);
        assertThat(results.get(0).result().outcome()).isEqualTo(StepOutcome.TIMEOUT);
        assertThat(results.get(0).result().retryable()).isTrue();
    }

    // ========== Deduplication Tests ==========

    @Test
    @DisplayName("A redelivered dispatch is executed once and its result republished")
    void shouldNotExecuteDuplicateDispatchTwice() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        registry.register(ActionCategory.READ, Set.of("read_file"), context -> {
            executions.incrementAndGet();
            return JsonNodeFactory.instance.textNode("content");
        });
        StepDispatch dispatch = dispatch(UUID.randomUUID(), "s1", 1,
            ActionDescriptor.of(ActionCategory.READ, "read_file", "notes.txt"), Duration.ofSeconds(5));

        send(dispatch);
        awaitResults(1);
        send(dispatch);
        awaitResults(2);

        assertThat(executions.get()).isEqualTo(1);
        assertThat(results.get(1).result()).isEqualTo(results.get(0).result());
    }

    @Test
    @DisplayName("A new attempt of the same step is executed again")
    void shouldExecuteNextAttempt() throws Exception {
        AtomicInteger executions = new AtomicInteger();
        registry.register(ActionCategory.READ, context -> {
            executions.incrementAndGet();
            return JsonNodeFactory.instance.textNode("content");
        });
        UUID taskId = UUID.randomUUID();
        ActionDescriptor action = ActionDescriptor.of(ActionCategory.READ, "read_file", "notes.txt");

        send(dispatch(taskId, "s1", 1, action, Duration.ofSeconds(5)));
        awaitResults(1);
        send(dispatch(taskId, "s1", 2, action, Duration.ofSeconds(5)));
        awaitResults(2);

        assertThat(executions.get()).isEqualTo(2);
    }

    @Test
    void shouldReportHealthAfterProcessing() throws Exception {
        registry.register(ActionCategory.READ, context -> JsonNodeFactory.instance.textNode("ok"));

        send(dispatch(UUID.randomUUID(), "s1", 1,
            ActionDescriptor.of(ActionCategory.READ, "read_file", "a"), Duration.ofSeconds(5)));
        awaitResults(1);

        assertThat(agent.health().status().wireName()).isEqualTo("ok");
        assertThat(agent.health().lastProcessedAt()).isNotNull();
    }
}
