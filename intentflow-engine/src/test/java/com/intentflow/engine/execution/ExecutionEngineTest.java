package com.intentflow.engine.execution;

import com.intentflow.core.bus.payload.RetryDue;
import com.intentflow.core.bus.payload.StepDispatch;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.AuditEntry;
import com.intentflow.core.model.Completeness;
import com.intentflow.core.model.FailureReason;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.PlanStatus;
import com.intentflow.core.model.RetryPolicy;
import com.intentflow.core.model.Step;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.core.test.TimeController;
import com.intentflow.engine.metrics.OrchestratorMetrics;
import com.intentflow.engine.persistence.InMemoryAuditRepository;
import com.intentflow.engine.security.AuditLog;
import com.intentflow.engine.test.RecordingStepDispatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionEngineTest {

    private final TimeController time = TimeController.frozen();
    private final UUID planId = UUID.randomUUID();
    private RecordingStepDispatcher dispatcher;
    private AuditLog auditLog;
    private SimpleMeterRegistry meters;
    private ExecutionEngine engine;
    private Task task;

    @BeforeEach
    void setUp() {
        dispatcher = new RecordingStepDispatcher();
        auditLog = new AuditLog(new InMemoryAuditRepository(), time);
        meters = new SimpleMeterRegistry();
        engine = new ExecutionEngine(dispatcher, auditLog, new ExecutionSettings(2, Duration.ofSeconds(30)),
            new OrchestratorMetrics(meters), time);
        task = Task.create(UUID.randomUUID(), "intent", "analyst", 3, time.now())
            .withStatus(TaskStatus.RUNNING, time.now());
    }

    // ========== Fixtures ==========

    private Step.Builder step(String id, ActionCategory category, String... dependsOn) {
        ActionDescriptor action = ActionDescriptor.of(category, "do_" + id, "target");
        Step.Builder builder = Step.builder(id, action)
            .planId(planId)
            .dependsOn(dependsOn)
            .parallelSafe(!category.hasSideEffects());
        if (category.hasSideEffects()) {
            builder.compensatingAction(ActionDescriptor.of(category, "undo_" + id, "target"));
        }
        return builder;
    }

    private Plan plan(Step.Builder... builders) {
        List<Step> steps = new ArrayList<>();
        for (int i = 0; i < builders.length; i++) {
            steps.add(builders[i].sequenceIndex(i).build());
        }
        return new Plan(planId, task.taskId(), 1, steps, Duration.ZERO, 0.2, PlanStatus.RUNNING, false,
            null, time.now());
    }

    private StepResult success(String stepId, int attempt) {
        return StepResult.success(task.taskId(), planId, stepId, attempt, StepKind.FORWARD, null, 5, time.now());
    }

    private StepResult compensated(String stepId) {
        return StepResult.success(task.taskId(), planId, stepId, 1, StepKind.COMPENSATION, null, 5, time.now());
    }

    private StepResult failure(String stepId, int attempt, boolean retryable) {
        return StepResult.failure(task.taskId(), planId, stepId, attempt, StepKind.FORWARD,
            "TOOL_ERROR", "tool failed", retryable, 5, time.now());
    }

    // ========== Forward execution ==========

    @Nested
    class Forward {

        @Test
        @DisplayName("Dependent steps are dispatched as their dependencies succeed")
        void shouldRunChainToCompletion() {
            Plan plan = plan(step("s1", ActionCategory.OPEN), step("s2", ActionCategory.COMPUTE, "s1"));

            ExecutionProgress started = engine.start(task, plan, AuditDecision.AUTO_APPROVED);
            assertThat(started.status()).isEqualTo(TaskStatus.RUNNING);
            assertThat(dispatcher.sequence()).containsExactly("s1#1");

            engine.apply(task, success("s1", 1));
            assertThat(dispatcher.sequence()).containsExactly("s1#1", "s2#1");

            ExecutionProgress done = engine.apply(task, success("s2", 1));
            assertThat(done.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(done.failure()).isNull();
            assertThat(engine.isActive(task.taskId())).isFalse();
        }

        @Test
        @DisplayName("Parallel-safe steps share the concurrency limit")
        void shouldRespectConcurrencyLimit() {
            Plan plan = plan(step("a", ActionCategory.READ), step("b", ActionCategory.READ),
                step("c", ActionCategory.READ));

            engine.start(task, plan, AuditDecision.AUTO_APPROVED);
            assertThat(dispatcher.sequence()).containsExactly("a#1", "b#1");

            engine.apply(task, success("b", 1));
            assertThat(dispatcher.sequence()).containsExactly("a#1", "b#1", "c#1");
        }

        @Test
        @DisplayName("A step that is not parallel-safe runs alone")
        void shouldRunExclusiveStepAlone() {
            Plan plan = plan(step("mail", ActionCategory.COMMUNICATE), step("look", ActionCategory.READ));

            engine.start(task, plan, AuditDecision.AUTO_APPROVED);
            assertThat(dispatcher.sequence()).containsExactly("mail#1");

            engine.apply(task, success("mail", 1));
            assertThat(dispatcher.sequence()).containsExactly("mail#1", "look#1");
        }

        @Test
        @DisplayName("Every dispatch is audited under the plan's authorization with the fence token")
        void shouldAuditDispatches() {
            Task fenced = task.withFenceToken(7);
            Plan plan = plan(step("s1", ActionCategory.READ));

            engine.start(fenced, plan, AuditDecision.CONFIRMED);

            StepDispatch dispatch = dispatcher.last();
            assertThat(dispatch.fenceToken()).isEqualTo(7);
            assertThat(dispatch.timeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(dispatch.roleScope()).isEqualTo("analyst");
            List<AuditEntry> entries = auditLog.entries(task.taskId());
            assertThat(entries).hasSize(1);
            assertThat(entries.get(0).stepId()).isEqualTo("s1");
            assertThat(entries.get(0).decision()).isEqualTo(AuditDecision.CONFIRMED);
            assertThat(entries.get(0).action()).isEqualTo("dispatch do_s1 attempt 1");
        }
    }

    // ========== Retries ==========

    @Nested
    class Retries {

        @Test
        @DisplayName("A retryable failure schedules the next attempt and waits for the timer")
        void shouldRetryWithBackoff() {
            Plan plan = plan(step("s1", ActionCategory.READ));
            engine.start(task, plan, AuditDecision.AUTO_APPROVED);

            ExecutionProgress retrying = engine.apply(task, failure("s1", 1, true));
            assertThat(retrying.status()).isEqualTo(TaskStatus.RETRYING);
            assertThat(dispatcher.retries()).containsExactly(new RetryDue(task.taskId(), "s1", 2));
            assertThat(dispatcher.sequence()).containsExactly("s1#1");

            engine.retryDue(task, new RetryDue(task.taskId(), "s1", 2));
            assertThat(dispatcher.sequence()).containsExactly("s1#1", "s1#2");

            assertThat(engine.apply(task, success("s1", 2)).status()).isEqualTo(TaskStatus.COMPLETED);
        }

        @Test
        @DisplayName("A stale retry timer changes nothing")
        void shouldIgnoreStaleTimer() {
            Plan plan = plan(step("s1", ActionCategory.READ));
            engine.start(task, plan, AuditDecision.AUTO_APPROVED);
            engine.apply(task, failure("s1", 1, true));

            ExecutionProgress stale = engine.retryDue(task, new RetryDue(task.taskId(), "s1", 5));

            assertThat(stale.ignored()).isTrue();
            assertThat(dispatcher.sequence()).containsExactly("s1#1");
        }

        @Test
        @DisplayName("A step that runs out of attempts fails the execution")
        void shouldStopAfterMaxAttempts() {
            Plan plan = plan(step("s1", ActionCategory.READ).retryPolicy(RetryPolicy.builder().maxAttempts(2).build()));
            engine.start(task, plan, AuditDecision.AUTO_APPROVED);
            engine.apply(task, failure("s1", 1, true));
            engine.retryDue(task, new RetryDue(task.taskId(), "s1", 2));

            ExecutionProgress failed = engine.apply(task, failure("s1", 2, true));

            assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(failed.failure().reason()).isEqualTo(FailureReason.STEP_EXECUTION);
            assertThat(failed.failure().stepId()).isEqualTo("s1");
            assertThat(failed.failure().completeness()).isEqualTo(Completeness.NOT_REQUIRED);
            assertThat(dispatcher.retries()).hasSize(1);
        }
    }

    // ========== Rollback ==========

    @Nested
    class Rollback {

        @Test
        @DisplayName("Succeeded steps are compensated one at a time, latest first")
        void shouldCompensateInReverseOrder() {
            Plan plan = plan(
                step("s1", ActionCategory.WRITE_SYSTEM_STATE),
                step("s2", ActionCategory.WRITE_SYSTEM_STATE, "s1"),
                step("s3", ActionCategory.WRITE_SYSTEM_STATE, "s2"));
            engine.start(task, plan, AuditDecision.CONFIRMED);
            engine.apply(task, success("s1", 1));
            engine.apply(task, success("s2", 1));

            ExecutionProgress rolling = engine.apply(task, failure("s3", 1, false));
            assertThat(rolling.status()).isEqualTo(TaskStatus.ROLLING_BACK);
            assertThat(dispatcher.sequence()).endsWith("s2#1:compensation");

            engine.apply(task, compensated("s2"));
            assertThat(dispatcher.sequence()).endsWith("s2#1:compensation", "s1#1:compensation");

            ExecutionProgress failed = engine.apply(task, compensated("s1"));
            assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(failed.failure().completeness()).isEqualTo(Completeness.FULL);
            assertThat(failed.failure().rollbackFailures()).isEmpty();
        }

        @Test
        @DisplayName("Steps without a compensation are skipped and the rollback is partial")
        void shouldReportPartialRollback() {
            Plan plan = plan(
                step("s1", ActionCategory.OPEN).compensatingAction(ActionDescriptor.of(ActionCategory.OPEN, "close_file", "r")),
                step("s2", ActionCategory.COMPUTE, "s1"),
                step("s3", ActionCategory.COMMUNICATE, "s2"));
            engine.start(task, plan, AuditDecision.CONFIRMED);
            engine.apply(task, success("s1", 1));
            engine.apply(task, success("s2", 1));
            engine.apply(task, failure("s3", 1, false));

            assertThat(dispatcher.last().stepId()).isEqualTo("s1");
            assertThat(dispatcher.last().kind()).isEqualTo(StepKind.COMPENSATION);
            assertThat(dispatcher.last().action().name()).isEqualTo("close_file");

            ExecutionProgress failed = engine.apply(task, compensated("s1"));
            assertThat(failed.failure().completeness()).isEqualTo(Completeness.PARTIAL);
        }

        @Test
        @DisplayName("Read-only work before a failure needs no rollback")
        void shouldNotRequireRollbackAfterReadOnlySteps() {
            Plan plan = plan(step("s1", ActionCategory.READ), step("s2", ActionCategory.COMPUTE, "s1"));
            engine.start(task, plan, AuditDecision.AUTO_APPROVED);
            engine.apply(task, success("s1", 1));

            ExecutionProgress failed = engine.apply(task, failure("s2", 1, false));

            assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(failed.failure().completeness()).isEqualTo(Completeness.NOT_REQUIRED);
            assertThat(failed.failure().compensationsSucceeded()).isTrue();
            assertThat(dispatcher.sequence()).containsExactly("s1#1", "s2#1");
        }

        @Test
        @DisplayName("A failed compensation is recorded and the rollback moves on")
        void shouldRecordRollbackFailure() {
            Plan plan = plan(
                step("s1", ActionCategory.WRITE_SYSTEM_STATE),
                step("s2", ActionCategory.WRITE_SYSTEM_STATE, "s1"),
                step("s3", ActionCategory.WRITE_SYSTEM_STATE, "s2"));
            engine.start(task, plan, AuditDecision.CONFIRMED);
            engine.apply(task, success("s1", 1));
            engine.apply(task, success("s2", 1));
            engine.apply(task, failure("s3", 1, false));

            engine.apply(task, StepResult.failure(task.taskId(), planId, "s2", 1, StepKind.COMPENSATION,
                "UNDO_FAILED", "cannot undo", false, 5, time.now()));
            ExecutionProgress failed = engine.apply(task, compensated("s1"));

            assertThat(failed.failure().completeness()).isEqualTo(Completeness.PARTIAL);
            assertThat(failed.failure().rollbackFailures()).singleElement()
                .satisfies(f -> assertThat(f.stepId()).isEqualTo("s2"));
        }

        @Test
        @DisplayName("Cancelling waits for the in-flight step, then rolls it back")
        void shouldCancelAndRollBack() {
            Plan plan = plan(step("s1", ActionCategory.WRITE_SYSTEM_STATE),
                step("s2", ActionCategory.WRITE_SYSTEM_STATE, "s1"));
            engine.start(task, plan, AuditDecision.CONFIRMED);

            ExecutionProgress halting = engine.cancel(task);
            assertThat(halting.status()).isEqualTo(TaskStatus.ROLLING_BACK);
            assertThat(dispatcher.sequence()).containsExactly("s1#1");

            engine.apply(task, success("s1", 1));
            assertThat(dispatcher.sequence()).containsExactly("s1#1", "s1#1:compensation");

            ExecutionProgress cancelled = engine.apply(task, compensated("s1"));
            assertThat(cancelled.status()).isEqualTo(TaskStatus.CANCELLED);
            assertThat(cancelled.failure().reason()).isEqualTo(FailureReason.CANCELLED);
            assertThat(cancelled.failure().completeness()).isEqualTo(Completeness.FULL);
        }
    }

    // ========== Idempotency and recovery ==========

    @Nested
    class Idempotency {

        @Test
        @DisplayName("A redelivered result is applied once")
        void shouldIgnoreDuplicateResult() {
            Plan plan = plan(step("s1", ActionCategory.READ), step("s2", ActionCategory.READ, "s1"));
            engine.start(task, plan, AuditDecision.AUTO_APPROVED);
            engine.apply(task, success("s1", 1));

            ExecutionProgress duplicate = engine.apply(task, success("s1", 1));

            assertThat(duplicate.ignored()).isTrue();
            assertThat(dispatcher.sequence()).containsExactly("s1#1", "s2#1");
            assertThat(meters.counter("intentflow.bus.duplicates").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Results of another plan version are ignored")
        void shouldIgnoreOtherPlan() {
            Plan plan = plan(step("s1", ActionCategory.READ));
            engine.start(task, plan, AuditDecision.AUTO_APPROVED);

            ExecutionProgress stale = engine.apply(task, StepResult.success(task.taskId(), UUID.randomUUID(), "s1", 1,
                StepKind.FORWARD, null, 5, time.now()));

            assertThat(stale.ignored()).isTrue();
            assertThat(engine.isActive(task.taskId())).isTrue();
        }

        @Test
        @DisplayName("Resuming replays recorded results and redispatches only what is outstanding")
        void shouldResumeFromRecordedResults() {
            Plan plan = plan(step("s1", ActionCategory.READ), step("s2", ActionCategory.COMPUTE, "s1"),
                step("s3", ActionCategory.COMPUTE, "s2"));
            List<StepResult> recorded = List.of(success("s1", 1), failure("s2", 1, true), success("s2", 2));

            ExecutionProgress resumed = engine.resume(task, plan, recorded, AuditDecision.AUTO_APPROVED);

            assertThat(resumed.status()).isEqualTo(TaskStatus.RUNNING);
            assertThat(dispatcher.sequence()).containsExactly("s3#1");

            assertThat(engine.apply(task, success("s3", 1)).status()).isEqualTo(TaskStatus.COMPLETED);
        }

        @Test
        @DisplayName("An attempt in flight at the crash is dispatched again with the same number")
        void shouldRedispatchInFlightAttempt() {
            Plan plan = plan(step("s1", ActionCategory.READ), step("s2", ActionCategory.COMPUTE, "s1"));

            engine.resume(task, plan, List.of(success("s1", 1)), AuditDecision.AUTO_APPROVED);

            assertThat(dispatcher.sequence()).containsExactly("s2#1");
        }

        @Test
        @DisplayName("A pending retry is rescheduled without delay on resume")
        void shouldRescheduleRetryOnResume() {
            Plan plan = plan(step("s1", ActionCategory.READ));

            engine.resume(task, plan, List.of(failure("s1", 1, true)), AuditDecision.AUTO_APPROVED);

            assertThat(dispatcher.sequence()).isEmpty();
            assertThat(dispatcher.retries()).containsExactly(new RetryDue(task.taskId(), "s1", 2));
            assertThat(dispatcher.retryDelays()).containsExactly(Duration.ZERO);
        }
    }
}
