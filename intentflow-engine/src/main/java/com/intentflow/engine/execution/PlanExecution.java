package com.intentflow.engine.execution;

import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.RollbackFailure;
import com.intentflow.core.model.Step;
import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable execution state of one plan. Only touched while holding its monitor.
 */
class PlanExecution {

    /**
     * Lifecycle of one step inside an execution.
     * Transitions:
     * WAITING -> DISPATCHED, SKIPPED;
     * DISPATCHED -> SUCCEEDED, FAILED, RETRY_PENDING;
     * RETRY_PENDING -> RETRY_READY, FAILED;
     * RETRY_READY -> DISPATCHED, FAILED
     */
    enum RunState {
        WAITING,
        DISPATCHED,
        RETRY_PENDING,
        RETRY_READY,
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    enum Phase {
        /** Dispatching steps as their dependencies complete. */
        FORWARD,
        /** A step failed for good or the task was cancelled; waiting for in-flight steps. */
        HALTING,
        /** Running compensations one at a time, latest completion first. */
        ROLLING_BACK,
        DONE
    }

    static final class StepRun {
        final Step step;
        RunState state = RunState.WAITING;
        int attempt;

        StepRun(Step step) {
            this.step = step;
        }

        boolean isReady() {
            return state == RunState.WAITING || state == RunState.RETRY_READY;
        }
    }

    final UUID taskId;
    final String roleScope;
    final int priority;
    final long fenceToken;
    final Plan plan;
    final AuditDecision authorization;
    final Instant startedAt;
    final Map<String, StepRun> runs = new LinkedHashMap<>();
    final List<String> completionOrder = new ArrayList<>();
    final Set<String> appliedKeys = new HashSet<>();
    final Deque<String> compensationQueue = new ArrayDeque<>();
    final List<RollbackFailure> rollbackFailures = new ArrayList<>();

    Phase phase = Phase.FORWARD;
    boolean cancelRequested;
    boolean replaying;
    String failedStepId;
    String failureMessage;
    String compensationInFlight;
    int compensated;
    TaskStatus finalStatus;

    PlanExecution(Task task, Plan plan, AuditDecision authorization, Instant startedAt) {
        this.taskId = task.taskId();
        this.roleScope = task.roleScope();
        this.priority = task.priority();
        this.fenceToken = task.fenceToken();
        this.plan = plan;
        this.authorization = authorization;
        this.startedAt = startedAt;
        this.cancelRequested = task.cancelRequested();
        for (Step step : plan.steps()) {
            runs.put(step.stepId(), new StepRun(step));
        }
    }

    boolean dependenciesMet(StepRun run) {
        for (String dependency : run.step.dependsOn()) {
            StepRun other = runs.get(dependency);
            if (other == null || other.state != RunState.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    long count(RunState state) {
        return runs.values().stream().filter(r -> r.state == state).count();
    }

    boolean exclusiveInFlight() {
        return runs.values().stream().anyMatch(r -> r.state == RunState.DISPATCHED && !r.step.parallelSafe());
    }

    boolean allSucceeded() {
        return runs.values().stream().allMatch(r -> r.state == RunState.SUCCEEDED);
    }

    /**
     * Task status matching the current phase.
     */
    TaskStatus taskStatus() {
        return switch (phase) {
            case FORWARD -> runs.values().stream().anyMatch(r -> r.state == RunState.RETRY_PENDING)
                ? TaskStatus.RETRYING
                : TaskStatus.RUNNING;
            case HALTING, ROLLING_BACK -> TaskStatus.ROLLING_BACK;
            case DONE -> finalStatus;
        };
    }
}
