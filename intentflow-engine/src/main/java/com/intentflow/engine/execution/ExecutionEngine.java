package com.intentflow.engine.execution;

import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.RetryDue;
import com.intentflow.core.bus.payload.StepDispatch;
import com.intentflow.core.logging.LoggingContext;
import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.Completeness;
import com.intentflow.core.model.FailureReason;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.RetryPolicy;
import com.intentflow.core.model.RollbackFailure;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskFailure;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.engine.execution.PlanExecution.Phase;
import com.intentflow.engine.execution.PlanExecution.RunState;
import com.intentflow.engine.execution.PlanExecution.StepRun;
import com.intentflow.engine.metrics.OrchestratorMetrics;
import com.intentflow.engine.security.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Retry and rollback state machine for accepted plans.
 *
 * Steps are dispatched as soon as their dependencies have succeeded. A step that is not
 * parallel-safe runs alone; parallel-safe steps share up to {@code concurrencyLimit}
 * slots. Failed attempts are retried with the step's backoff while the error is
 * retryable and attempts remain. Once a step fails for good, or the task is cancelled,
 * nothing new is dispatched; when in-flight steps have reported, the compensations of
 * all succeeded steps run one at a time in reverse completion order.
 *
 * Results are applied at most once per deduplication key; results of other plan
 * versions or superseded attempts are ignored.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final StepDispatcher dispatcher;
    private final AuditLog auditLog;
    private final ExecutionSettings settings;
    private final OrchestratorMetrics metrics;
    private final Clock clock;
    private final Map<UUID, PlanExecution> executions = new ConcurrentHashMap<>();

    public ExecutionEngine(StepDispatcher dispatcher, AuditLog auditLog, ExecutionSettings settings,
                           OrchestratorMetrics metrics, Clock clock) {
        this.dispatcher = dispatcher;
        this.auditLog = auditLog;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Start executing an accepted plan.
     *
     * @param authorization Gate decision the dispatches are audited under
     */
    public ExecutionProgress start(Task task, Plan plan, AuditDecision authorization) {
        auditLog.requireIntact(task.taskId());
        PlanExecution execution = new PlanExecution(task, plan, authorization, clock.instant());
        executions.put(task.taskId(), execution);
        synchronized (execution) {
            try (LoggingContext ctx = LoggingContext.forTask(task.taskId(), plan.planId())) {
                log.info("Executing plan v{} with {} steps", plan.version(), plan.steps().size());
                if (execution.cancelRequested) {
                    halt(execution, null, "Cancelled before the first dispatch");
                } else {
                    pump(execution);
                }
                return progress(execution);
            }
        }
    }

    /**
     * Rebuild the execution of a plan from its recorded results and dispatch whatever
     * is still outstanding. Attempts that were in flight are dispatched again with the
     * same attempt number; executors answer those from their own records.
     */
    public ExecutionProgress resume(Task task, Plan plan, List<StepResult> results, AuditDecision authorization) {
        auditLog.requireIntact(task.taskId());
        PlanExecution execution = new PlanExecution(task, plan, authorization, clock.instant());
        executions.put(task.taskId(), execution);
        synchronized (execution) {
            try (LoggingContext ctx = LoggingContext.forTask(task.taskId(), plan.planId())) {
                // a cancel is applied after the recorded results, which may predate it
                boolean cancelRequested = execution.cancelRequested;
                execution.cancelRequested = false;
                execution.replaying = true;
                pump(execution);
                int replayed = 0;
                for (StepResult result : results) {
                    if (!plan.planId().equals(result.planId())) {
                        continue;
                    }
                    if (result.kind() == StepKind.FORWARD) {
                        catchUp(execution, result);
                    }
                    if (applyResult(execution, result)) {
                        replayed++;
                    }
                }
                execution.cancelRequested = cancelRequested;
                if (cancelRequested && execution.phase == Phase.FORWARD) {
                    halt(execution, null, "Cancelled");
                }
                execution.replaying = false;
                log.info("Resumed plan v{} from {} recorded results", plan.version(), replayed);

                redispatchOutstanding(execution);
                return progress(execution);
            }
        }
    }

    /**
     * Apply a step result.
     */
    public ExecutionProgress apply(Task task, StepResult result) {
        PlanExecution execution = executions.get(task.taskId());
        if (execution == null) {
            log.debug("No active execution for task {}, ignoring result {}", task.taskId(), result.dedupKey());
            return ExecutionProgress.ignored(task.taskId(), task.status());
        }
        synchronized (execution) {
            try (LoggingContext ctx = LoggingContext.forStep(task.taskId(), result.stepId(), result.attempt())) {
                if (!applyResult(execution, result)) {
                    return ExecutionProgress.ignored(task.taskId(), execution.taskStatus());
                }
                return progress(execution);
            }
        }
    }

    /**
     * Dispatch the next attempt of a step whose backoff elapsed.
     */
    public ExecutionProgress retryDue(Task task, RetryDue due) {
        PlanExecution execution = executions.get(task.taskId());
        if (execution == null) {
            return ExecutionProgress.ignored(task.taskId(), task.status());
        }
        synchronized (execution) {
            try (LoggingContext ctx = LoggingContext.forStep(task.taskId(), due.stepId(), due.attempt())) {
                StepRun run = execution.runs.get(due.stepId());
                if (execution.phase != Phase.FORWARD || run == null
                        || run.state != RunState.RETRY_PENDING || due.attempt() != run.attempt + 1) {
                    log.debug("Stale retry timer for attempt {}", due.attempt());
                    return ExecutionProgress.ignored(task.taskId(), execution.taskStatus());
                }
                run.state = RunState.RETRY_READY;
                pump(execution);
                return progress(execution);
            }
        }
    }

    /**
     * Stop dispatching and roll back what already succeeded.
     */
    public ExecutionProgress cancel(Task task) {
        PlanExecution execution = executions.get(task.taskId());
        if (execution == null) {
            return ExecutionProgress.ignored(task.taskId(), task.status());
        }
        synchronized (execution) {
            try (LoggingContext ctx = LoggingContext.forTask(task.taskId(), execution.plan.planId())) {
                if (execution.cancelRequested || execution.phase != Phase.FORWARD) {
                    execution.cancelRequested = true;
                    return ExecutionProgress.ignored(task.taskId(), execution.taskStatus());
                }
                execution.cancelRequested = true;
                log.info("Cancelling execution");
                halt(execution, null, "Cancelled");
                return progress(execution);
            }
        }
    }

    public boolean isActive(UUID taskId) {
        return executions.containsKey(taskId);
    }

    /**
     * Drop in-memory state of a task, e.g. after its lease was lost.
     */
    public void forget(UUID taskId) {
        executions.remove(taskId);
    }

    // ========== Result handling ==========

    /**
     * @return false if the result was a duplicate or stale
     */
    private boolean applyResult(PlanExecution execution, StepResult result) {
        String key = result.dedupKey();
        if (execution.appliedKeys.contains(key)) {
            log.debug("DuplicateMessageIgnored: {}", key);
            if (!execution.replaying) {
                metrics.duplicateIgnored();
            }
            return false;
        }
        if (!execution.plan.planId().equals(result.planId())) {
            log.debug("Result {} belongs to plan {}, not {}", key, result.planId(), execution.plan.planId());
            return false;
        }
        StepRun run = execution.runs.get(result.stepId());
        if (run == null) {
            log.warn("Result {} names an unknown step", key);
            return false;
        }

        boolean applied = result.kind() == StepKind.COMPENSATION
            ? applyCompensation(execution, run, result)
            : applyForward(execution, run, result);
        if (applied) {
            execution.appliedKeys.add(key);
            if (!execution.replaying) {
                metrics.stepResult(result.kind(), result.outcome());
            }
        }
        return applied;
    }

    private boolean applyForward(PlanExecution execution, StepRun run, StepResult result) {
        if (run.state != RunState.DISPATCHED || result.attempt() != run.attempt) {
            log.debug("Stale result for attempt {} (step is {} at attempt {})",
                result.attempt(), run.state, run.attempt);
            return false;
        }

        if (result.isSuccess()) {
            run.state = RunState.SUCCEEDED;
            execution.completionOrder.add(run.step.stepId());
            log.info("Step {} succeeded on attempt {}", run.step.stepId(), result.attempt());
        } else if (execution.phase == Phase.FORWARD && isRetryable(run.step.retryPolicy(), result)
                && !execution.cancelRequested) {
            run.state = RunState.RETRY_PENDING;
            Duration backoff = run.step.retryPolicy().computeBackoff(result.attempt());
            log.warn("Step {} attempt {} failed ({}), retrying in {} ms",
                run.step.stepId(), result.attempt(), result.errorCode(), backoff.toMillis());
            if (!execution.replaying) {
                metrics.stepRetried();
                dispatcher.scheduleRetry(new RetryDue(execution.taskId, run.step.stepId(), result.attempt() + 1),
                    execution.priority, backoff);
            }
        } else {
            run.state = RunState.FAILED;
            log.warn("Step {} failed for good on attempt {}: {} {}", run.step.stepId(), result.attempt(),
                result.errorCode(), result.errorMessage());
            if (execution.phase == Phase.FORWARD) {
                halt(execution, run.step.stepId(), describe(result));
                return true;
            }
        }

        advance(execution);
        return true;
    }

    private boolean applyCompensation(PlanExecution execution, StepRun run, StepResult result) {
        if (execution.phase != Phase.ROLLING_BACK || !run.step.stepId().equals(execution.compensationInFlight)
                || result.attempt() != 1) {
            log.debug("Unexpected compensation result for {}", run.step.stepId());
            return false;
        }
        execution.compensationInFlight = null;
        if (result.isSuccess()) {
            execution.compensated++;
            log.info("Compensated step {}", run.step.stepId());
        } else {
            execution.rollbackFailures.add(new RollbackFailure(run.step.stepId(), result.errorCode(),
                result.errorMessage(), result.timestamp()));
            log.warn("Compensation of step {} failed: {}", run.step.stepId(), result.errorCode());
        }
        if (!execution.replaying) {
            metrics.compensation(result.isSuccess());
        }
        nextCompensation(execution);
        return true;
    }

    private static boolean isRetryable(RetryPolicy policy, StepResult result) {
        return result.retryable()
            && policy.shouldRetry(result.errorCode())
            && policy.hasMoreAttempts(result.attempt());
    }

    private static String describe(StepResult result) {
        String code = result.errorCode() != null ? result.errorCode() : result.outcome().name();
        return result.errorMessage() != null ? code + ": " + result.errorMessage() : code;
    }

    // ========== Transitions ==========

    private void advance(PlanExecution execution) {
        switch (execution.phase) {
            case FORWARD -> pump(execution);
            case HALTING -> {
                if (execution.count(RunState.DISPATCHED) == 0) {
                    beginRollback(execution);
                }
            }
            default -> {
            }
        }
    }

    /**
     * Dispatch every ready step the concurrency rules allow, in plan order.
     */
    private void pump(PlanExecution execution) {
        if (execution.allSucceeded()) {
            finish(execution, TaskStatus.COMPLETED);
            return;
        }
        long inFlight = execution.count(RunState.DISPATCHED);
        if (execution.exclusiveInFlight()) {
            return;
        }
        for (StepRun run : execution.runs.values()) {
            if (!run.isReady() || !execution.dependenciesMet(run)) {
                continue;
            }
            if (!run.step.parallelSafe()) {
                if (inFlight == 0) {
                    dispatchForward(execution, run);
                }
                return;
            }
            if (inFlight >= settings.concurrencyLimit()) {
                return;
            }
            dispatchForward(execution, run);
            inFlight++;
        }
    }

    private void halt(PlanExecution execution, String failedStepId, String message) {
        execution.phase = Phase.HALTING;
        execution.failedStepId = failedStepId;
        execution.failureMessage = message;
        for (StepRun run : execution.runs.values()) {
            if (run.state == RunState.WAITING) {
                run.state = RunState.SKIPPED;
            } else if (run.state == RunState.RETRY_PENDING || run.state == RunState.RETRY_READY) {
                run.state = RunState.FAILED;
            }
        }
        log.info("Halted: {}", message);
        if (execution.count(RunState.DISPATCHED) == 0) {
            beginRollback(execution);
        }
    }

    private void beginRollback(PlanExecution execution) {
        List<String> reversed = new ArrayList<>(execution.completionOrder);
        Collections.reverse(reversed);
        for (String stepId : reversed) {
            if (execution.runs.get(stepId).step.hasCompensation()) {
                execution.compensationQueue.add(stepId);
            }
        }
        if (execution.compensationQueue.isEmpty()) {
            finish(execution, execution.cancelRequested ? TaskStatus.CANCELLED : TaskStatus.FAILED);
            return;
        }
        execution.phase = Phase.ROLLING_BACK;
        log.info("Rolling back {} steps in order {}", execution.compensationQueue.size(), execution.compensationQueue);
        nextCompensation(execution);
    }

    private void nextCompensation(PlanExecution execution) {
        String next = execution.compensationQueue.poll();
        if (next == null) {
            finish(execution, execution.cancelRequested ? TaskStatus.CANCELLED : TaskStatus.FAILED);
            return;
        }
        execution.compensationInFlight = next;
        dispatchCompensation(execution, execution.runs.get(next));
    }

    private void finish(PlanExecution execution, TaskStatus status) {
        execution.phase = Phase.DONE;
        execution.finalStatus = status;
        if (!execution.replaying) {
            executions.remove(execution.taskId, execution);
        }
        if (status == TaskStatus.COMPLETED) {
            log.info("All {} steps succeeded", execution.runs.size());
        } else {
            log.info("Execution ended {}: {} of {} succeeded steps compensated", status,
                execution.compensated, execution.completionOrder.size());
        }
    }

    private ExecutionProgress progress(PlanExecution execution) {
        TaskStatus status = execution.taskStatus();
        TaskFailure failure = null;
        if (execution.phase == Phase.DONE && status != TaskStatus.COMPLETED) {
            long reversible = execution.completionOrder.stream()
                .map(stepId -> execution.runs.get(stepId).step)
                .filter(step -> step.hasCompensation() || step.action().category().hasSideEffects())
                .count();
            Completeness completeness = Completeness.of(execution.completionOrder.size(), (int) reversible,
                execution.compensated);
            FailureReason reason = status == TaskStatus.CANCELLED ? FailureReason.CANCELLED : FailureReason.STEP_EXECUTION;
            String message = execution.failureMessage != null ? execution.failureMessage : status.name();
            failure = new TaskFailure(reason, message, execution.failedStepId, completeness,
                execution.rollbackFailures);
        }
        return new ExecutionProgress(execution.taskId, status, failure, false);
    }

    // ========== Dispatch ==========

    private void dispatchForward(PlanExecution execution, StepRun run) {
        run.attempt++;
        run.state = RunState.DISPATCHED;
        if (!execution.replaying) {
            send(execution, run, StepKind.FORWARD, run.step.action(), run.attempt);
        }
    }

    private void dispatchCompensation(PlanExecution execution, StepRun run) {
        if (!execution.replaying) {
            send(execution, run, StepKind.COMPENSATION, run.step.compensatingAction(), 1);
        }
    }

    private void send(PlanExecution execution, StepRun run, StepKind kind, ActionDescriptor action, int attempt) {
        String verb = kind == StepKind.COMPENSATION ? "compensate " : "dispatch ";
        auditLog.append(execution.taskId, run.step.stepId(), Topics.EXECUTION,
            verb + action.name() + " attempt " + attempt, run.step.riskScore(), execution.authorization);
        dispatcher.dispatch(new StepDispatch(execution.taskId, execution.plan.planId(), run.step.stepId(), attempt,
            kind, action, execution.roleScope, settings.stepTimeout(), execution.fenceToken), execution.priority);
        metrics.stepDispatched(kind);
        log.debug("Dispatched {} {} attempt {}", kind, action.name(), attempt);
    }

    /**
     * During replay, a recorded result may belong to an attempt the replayed state has
     * not reached yet, e.g. the attempt after a retry timer. Move the step forward to it.
     */
    private static void catchUp(PlanExecution execution, StepResult result) {
        StepRun run = execution.runs.get(result.stepId());
        if (run == null || execution.phase == Phase.DONE) {
            return;
        }
        boolean behind = run.state == RunState.WAITING || run.state == RunState.RETRY_PENDING
            || run.state == RunState.RETRY_READY;
        if (behind && result.attempt() > run.attempt && execution.dependenciesMet(run)) {
            run.attempt = result.attempt();
            run.state = RunState.DISPATCHED;
        }
    }

    private void redispatchOutstanding(PlanExecution execution) {
        if (execution.phase == Phase.DONE) {
            executions.remove(execution.taskId, execution);
            return;
        }
        for (StepRun run : execution.runs.values()) {
            if (run.state == RunState.DISPATCHED) {
                send(execution, run, StepKind.FORWARD, run.step.action(), run.attempt);
            } else if (run.state == RunState.RETRY_PENDING || run.state == RunState.RETRY_READY) {
                run.state = RunState.RETRY_PENDING;
                dispatcher.scheduleRetry(new RetryDue(execution.taskId, run.step.stepId(), run.attempt + 1),
                    execution.priority, Duration.ZERO);
            }
        }
        if (execution.compensationInFlight != null) {
            dispatchCompensation(execution, execution.runs.get(execution.compensationInFlight));
        }
        if (execution.phase == Phase.FORWARD) {
            pump(execution);
        }
    }

    Optional<PlanExecution> execution(UUID taskId) {
        return Optional.ofNullable(executions.get(taskId));
    }
}
