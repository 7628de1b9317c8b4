package com.intentflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageType;
import com.intentflow.core.bus.Subscription;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.StepDispatch;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.health.AgentHealth;
import com.intentflow.core.health.AgentLiveness;
import com.intentflow.core.health.HealthReporter;
import com.intentflow.core.logging.LoggingContext;
import com.intentflow.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes STEP_DISPATCH messages, runs the matching executor and publishes a STEP_RESULT.
 *
 * Execution happens off the bus thread so steps of one task that were dispatched in
 * parallel do run in parallel. A dispatch redelivered while its attempt is still running
 * is dropped; one redelivered after completion gets the recorded result again, so an
 * attempt's effects are produced at most once per agent.
 */
public class ExecutionAgent implements HealthReporter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionAgent.class);

    public static final String NO_EXECUTOR = "NO_EXECUTOR";
    public static final String EXECUTOR_ERROR = "EXECUTOR_ERROR";

    private final MessageBus bus;
    private final MessageCodec codec;
    private final ExecutorRegistry registry;
    private final Clock clock;
    private final ExecutorService executorService;
    private final ScheduledExecutorService timeoutScheduler;
    private final AgentLiveness liveness;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<String, StepResult> completed;

    private volatile Subscription subscription;

    public ExecutionAgent(MessageBus bus, MessageCodec codec, ExecutorRegistry registry, Clock clock) {
        this(bus, codec, registry, clock, 8, 10_000);
    }

    public ExecutionAgent(MessageBus bus, MessageCodec codec, ExecutorRegistry registry, Clock clock,
                          int maxConcurrentSteps, int resultCacheSize) {
        this.bus = bus;
        this.codec = codec;
        this.registry = registry;
        this.clock = clock;
        this.executorService = Executors.newFixedThreadPool(maxConcurrentSteps, namedThreads("step-executor"));
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("step-timeout"));
        this.liveness = new AgentLiveness(Topics.EXECUTION, clock);
        this.completed = Collections.synchronizedMap(new LinkedHashMap<>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, StepResult> eldest) {
                return size() > resultCacheSize;
            }
        });
    }

    /**
     * Start consuming step dispatches.
     */
    public void start() {
        subscription = bus.subscribe(Topics.STEP_DISPATCH, Topics.EXECUTION, this::onMessage);
        liveness.started();
        log.info("Execution agent started");
    }

    /**
     * Stop consuming and wait for running steps to finish.
     */
    public void stop() {
        if (subscription != null) {
            subscription.close();
        }
        liveness.stopped();
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timeoutScheduler.shutdownNow();
        log.info("Execution agent stopped");
    }

    @Override
    public AgentHealth health() {
        return liveness.health();
    }

    void onMessage(MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.STEP_DISPATCH) {
            log.debug("Ignoring {} on dispatch topic", envelope.messageType());
            return;
        }
        StepDispatch dispatch = codec.fromPayload(envelope, StepDispatch.class);
        String key = dispatch.dedupKey();

        try (LoggingContext ctx = LoggingContext.forStep(dispatch.taskId(), dispatch.stepId(), dispatch.attempt())) {
            StepResult previous = completed.get(key);
            if (previous != null) {
                log.debug("Dispatch {} already executed, republishing its result", key);
                publish(dispatch, previous, envelope.priority());
                return;
            }
            if (!inFlight.add(key)) {
                log.debug("Dispatch {} is still running, ignoring redelivery", key);
                return;
            }
            submit(dispatch, envelope.priority());
        }
    }

    private void submit(StepDispatch dispatch, int priority) {
        Optional<StepExecutor> executor = registry.resolve(dispatch.action());
        Instant startedAt = clock.instant();
        if (executor.isEmpty()) {
            log.warn("No executor registered for {}/{}", dispatch.action().category(), dispatch.action().name());
            complete(dispatch, priority, StepResult.failure(dispatch.taskId(), dispatch.planId(),
                dispatch.stepId(), dispatch.attempt(), dispatch.kind(), NO_EXECUTOR,
                "No executor for " + dispatch.action().name(), false, 0, startedAt));
            return;
        }

        AtomicBoolean reported = new AtomicBoolean();
        Future<?> running = executorService.submit(() -> {
            StepResult result = run(executor.get(), dispatch, startedAt);
            if (reported.compareAndSet(false, true)) {
                complete(dispatch, priority, result);
            }
        });

        Duration timeout = dispatch.timeout();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            timeoutScheduler.schedule(() -> {
                if (reported.compareAndSet(false, true)) {
                    running.cancel(true);
                    long elapsed = Duration.between(startedAt, clock.instant()).toMillis();
                    try (LoggingContext ctx = LoggingContext.forStep(dispatch.taskId(), dispatch.stepId(),
                            dispatch.attempt())) {
                        log.warn("Step timed out after {} ms", elapsed);
                        complete(dispatch, priority, StepResult.timeout(dispatch.taskId(), dispatch.planId(),
                            dispatch.stepId(), dispatch.attempt(), dispatch.kind(), elapsed, clock.instant()));
                    }
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private StepResult run(StepExecutor executor, StepDispatch dispatch, Instant startedAt) {
        try (LoggingContext ctx = LoggingContext.forStep(dispatch.taskId(), dispatch.stepId(), dispatch.attempt())) {
            log.info("Executing {} {} ({})", dispatch.kind(), dispatch.action().name(), dispatch.action().category());
            try {
                JsonNode output = executor.execute(new StepContext(dispatch, codec.objectMapper()));
                long elapsed = Duration.between(startedAt, clock.instant()).toMillis();
                log.info("Step succeeded in {} ms", elapsed);
                return StepResult.success(dispatch.taskId(), dispatch.planId(), dispatch.stepId(),
                    dispatch.attempt(), dispatch.kind(), output, elapsed, clock.instant());

            } catch (StepExecutionException e) {
                long elapsed = Duration.between(startedAt, clock.instant()).toMillis();
                log.warn("Step failed: {} - {}", e.getErrorCode(), e.getMessage());
                return StepResult.failure(dispatch.taskId(), dispatch.planId(), dispatch.stepId(),
                    dispatch.attempt(), dispatch.kind(), e.getErrorCode(), e.getMessage(), e.isRetryable(),
                    elapsed, clock.instant());

            } catch (RuntimeException e) {
                long elapsed = Duration.between(startedAt, clock.instant()).toMillis();
                log.error("Step failed with unexpected error", e);
                return StepResult.failure(dispatch.taskId(), dispatch.planId(), dispatch.stepId(),
                    dispatch.attempt(), dispatch.kind(), EXECUTOR_ERROR, e.getMessage(), true,
                    elapsed, clock.instant());
            }
        }
    }

    private void complete(StepDispatch dispatch, int priority, StepResult result) {
        completed.put(dispatch.dedupKey(), result);
        inFlight.remove(dispatch.dedupKey());
        try {
            publish(dispatch, result, priority);
            liveness.processed();
        } catch (RuntimeException e) {
            // the orchestrator re-dispatches attempts without a result once it resumes
            log.error("Could not publish result of {}", dispatch.dedupKey(), e);
            liveness.failed(e);
        }
    }

    private void publish(StepDispatch dispatch, StepResult result, int priority) {
        StepResultMessage message = new StepResultMessage(result, dispatch.action(), dispatch.roleScope());
        bus.publish(Topics.STEP_RESULTS, MessageEnvelope.create(Topics.EXECUTION, Topics.ORCHESTRATOR,
            MessageType.STEP_RESULT, codec.toPayload(message), priority,
            dispatch.taskId().toString(), clock.instant()));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
