package com.intentflow.engine.coordinator;

import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageType;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.CancelRequest;
import com.intentflow.core.bus.payload.PlanProposed;
import com.intentflow.core.bus.payload.RetryDue;
import com.intentflow.core.bus.payload.SecurityDecisionNotice;
import com.intentflow.core.bus.payload.StepResultMessage;
import com.intentflow.core.exception.AuditChainBrokenException;
import com.intentflow.core.exception.ConfirmationTimeoutException;
import com.intentflow.core.exception.DuplicateTaskException;
import com.intentflow.core.exception.InvalidStateTransitionException;
import com.intentflow.core.exception.LeaseAcquisitionException;
import com.intentflow.core.exception.MissingCompensationException;
import com.intentflow.core.exception.NotFoundException;
import com.intentflow.core.exception.OrchestratorException;
import com.intentflow.core.exception.PlanCycleException;
import com.intentflow.core.exception.PlanValidationException;
import com.intentflow.core.exception.RiskExceededException;
import com.intentflow.core.logging.LoggingContext;
import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.AuditEntry;
import com.intentflow.core.model.Completeness;
import com.intentflow.core.model.FailureReason;
import com.intentflow.core.model.FeedbackRecord;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.PlanStatus;
import com.intentflow.core.model.Step;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskFailure;
import com.intentflow.core.model.TaskLease;
import com.intentflow.core.model.TaskRequest;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.core.repository.PlanRepository;
import com.intentflow.core.repository.StepResultRepository;
import com.intentflow.core.repository.TaskRepository;
import com.intentflow.engine.execution.ExecutionEngine;
import com.intentflow.engine.execution.ExecutionProgress;
import com.intentflow.engine.metrics.OrchestratorMetrics;
import com.intentflow.engine.planning.PlanningRequest;
import com.intentflow.engine.planning.PlanningService;
import com.intentflow.engine.security.AuditLog;
import com.intentflow.engine.security.ConfirmationTokenService;
import com.intentflow.engine.security.GateDecision;
import com.intentflow.engine.security.SecurityGate;
import com.intentflow.engine.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives every task from submission to a terminal outcome.
 *
 * This is the only component that changes a task's status. Work on one task is
 * serialized by a per-task lock, and only the holder of the task's lease applies
 * step results or dispatches steps.
 */
public class TaskOrchestrator implements TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private final TaskRepository taskRepository;
    private final PlanRepository planRepository;
    private final StepResultRepository resultRepository;
    private final AuditLog auditLog;
    private final PlanningService planning;
    private final SecurityGate gate;
    private final ConfirmationTokenService tokens;
    private final ExecutionEngine engine;
    private final LeaseManager leases;
    private final MessageBus bus;
    private final MessageCodec codec;
    private final OrchestratorMetrics metrics;
    private final Clock clock;
    private final int replanAttempts;
    private final TaskLocks locks = new TaskLocks();

    public TaskOrchestrator(
            TaskRepository taskRepository,
            PlanRepository planRepository,
            StepResultRepository resultRepository,
            AuditLog auditLog,
            PlanningService planning,
            SecurityGate gate,
            ConfirmationTokenService tokens,
            ExecutionEngine engine,
            LeaseManager leases,
            MessageBus bus,
            MessageCodec codec,
            OrchestratorMetrics metrics,
            Clock clock,
            int replanAttempts) {
        this.taskRepository = taskRepository;
        this.planRepository = planRepository;
        this.resultRepository = resultRepository;
        this.auditLog = auditLog;
        this.planning = planning;
        this.gate = gate;
        this.tokens = tokens;
        this.engine = engine;
        this.leases = leases;
        this.bus = bus;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
        this.replanAttempts = replanAttempts;
    }

    // ========== Caller operations ==========

    @Override
    public TaskSubmission submitTask(TaskRequest request) {
        UUID taskId = request.taskId() != null ? request.taskId() : UUID.randomUUID();
        Optional<Task> existing = taskRepository.findById(taskId);
        if (existing.isPresent()) {
            log.info("Task {} already submitted, returning its state", taskId);
            return submissionOf(existing.get(), null);
        }

        Task task;
        try {
            task = taskRepository.save(Task.create(taskId, request.intent(), request.roleScope(),
                request.priority(), clock.instant()));
        } catch (DuplicateTaskException e) {
            return submissionOf(load(taskId), null);
        }
        metrics.taskSubmitted();

        return withLock(taskId, () -> {
            try (LoggingContext ctx = LoggingContext.forTask(taskId)) {
                log.info("Submitted task for role {}: '{}'", request.roleScope(), request.intent());
                Task planningTask = transition(lease(task), TaskStatus.PLANNING);
                return planAndGate(planningTask,
                    PlanningRequest.initial(taskId, planningTask.intent(), planningTask.roleScope()));
            }
        });
    }

    @Override
    public TaskView confirm(UUID taskId, String confirmationToken, String actor) {
        return withLock(taskId, () -> {
            try (LoggingContext ctx = LoggingContext.forTask(taskId)) {
                Task task = load(taskId);
                if (task.status() != TaskStatus.AWAITING_CONFIRMATION) {
                    throw new InvalidStateTransitionException("Task", task.status().name(), "confirm");
                }
                Plan plan = currentPlan(task);
                Task leased = lease(task);
                try {
                    gate.confirm(leased, plan, confirmationToken, actor != null ? actor : Topics.API);
                } catch (ConfirmationTimeoutException e) {
                    fail(leased, FailureReason.CONFIRMATION_TIMEOUT, e.getMessage());
                    throw e;
                }
                log.info("Plan v{} confirmed by {}", plan.version(), actor);
                metrics.gateDecision(AuditDecision.CONFIRMED);
                planRepository.updateStatus(plan.planId(), PlanStatus.ACCEPTED);
                Task started = startExecution(leased, plan, AuditDecision.CONFIRMED);
                return view(started);
            }
        });
    }

    @Override
    public void requestCancel(UUID taskId, String reason) {
        Task task = load(taskId);
        publish(Topics.TASKS, Topics.ORCHESTRATOR, MessageType.CANCEL, new CancelRequest(taskId, reason),
            task.priority(), taskId);
        log.info("Cancellation of task {} requested: {}", taskId, reason);
    }

    @Override
    public TaskView cancel(UUID taskId, String reason) {
        return withLock(taskId, () -> {
            try (LoggingContext ctx = LoggingContext.forTask(taskId)) {
                Task task = load(taskId);
                if (task.isTerminal()) {
                    log.debug("Task already {}, nothing to cancel", task.status());
                    return view(task);
                }
                String message = reason != null && !reason.isBlank() ? reason : "Cancelled by request";

                if (!task.status().isExecuting()) {
                    tokens.revoke(taskId);
                    if (task.currentPlanId() != null) {
                        planRepository.updateStatus(task.currentPlanId(), PlanStatus.FAILED);
                    }
                    Task cancelled = terminate(task, TaskStatus.CANCELLED, new TaskFailure(FailureReason.CANCELLED,
                        message, null, Completeness.NOT_REQUIRED, List.of()));
                    return view(cancelled);
                }

                Task flagged = task.cancelRequested() ? task : update(task.withCancelRequested(clock.instant()));
                if (engine.isActive(taskId) && leases.holds(taskId)) {
                    flagged = applyProgress(flagged, engine.cancel(flagged));
                } else {
                    log.info("Task is executing elsewhere, its owner picks up the cancellation");
                }
                return view(flagged);
            }
        });
    }

    @Override
    public void submitFeedback(UUID taskId, int humanRating, String correctionNotes) {
        Task task = load(taskId);
        FeedbackRecord feedback = new FeedbackRecord(taskId, humanRating, correctionNotes, clock.instant());
        publish(Topics.FEEDBACK, Topics.LEARNING, MessageType.FEEDBACK, feedback, task.priority(), taskId);
        log.info("Feedback {} for task {} submitted", humanRating, taskId);
    }

    @Override
    public TaskView getTask(UUID taskId) {
        return view(load(taskId));
    }

    @Override
    public List<TaskView> findTasks(TaskStatus status, int limit) {
        List<Task> tasks = status != null
            ? taskRepository.findByStatus(status, limit)
            : taskRepository.findNonTerminal(limit);
        return tasks.stream().map(this::view).toList();
    }

    @Override
    public AuditTrail auditTrail(UUID taskId) {
        load(taskId);
        return new AuditTrail(taskId, auditLog.entries(taskId), auditLog.verify(taskId));
    }

    // ========== Bus events ==========

    /**
     * Record a step result and advance the task it belongs to. A result already recorded,
     * e.g. by an instance that has since lost the lease, is still offered to the engine,
     * which applies every deduplication key once.
     */
    public void onStepResult(StepResultMessage message) {
        StepResult result = message.result();
        if (!resultRepository.append(result)) {
            log.debug("Result {} was already recorded", result.dedupKey());
        }
        withLock(result.taskId(), () -> {
            try (LoggingContext ctx = LoggingContext.forStep(result.taskId(), result.stepId(), result.attempt())) {
                Optional<Task> found = taskRepository.findById(result.taskId());
                if (found.isEmpty()) {
                    log.warn("Result {} for unknown task", result.dedupKey());
                    return null;
                }
                Task task = found.get();
                if (task.isTerminal()) {
                    log.debug("Task already {}, result recorded only", task.status());
                    return null;
                }
                if (!leases.holds(task.taskId())) {
                    log.debug("Not the lease holder, result recorded only");
                    return null;
                }
                if (task.cancelRequested()) {
                    task = applyProgress(task, engine.cancel(task));
                }
                applyProgress(task, engine.apply(task, result));
                return null;
            }
        });
    }

    public void onRetryDue(RetryDue due) {
        withLock(due.taskId(), () -> {
            try (LoggingContext ctx = LoggingContext.forStep(due.taskId(), due.stepId(), due.attempt())) {
                Optional<Task> found = taskRepository.findById(due.taskId());
                if (found.isEmpty() || found.get().isTerminal() || !leases.holds(due.taskId())) {
                    log.debug("Ignoring retry timer");
                    return null;
                }
                applyProgress(found.get(), engine.retryDue(found.get(), due));
                return null;
            }
        });
    }

    // ========== Recovery ==========

    /**
     * Take over a task whose previous owner is gone and continue it from its recorded state.
     *
     * @return true if this instance now drives the task
     */
    public boolean resumeTask(UUID taskId) {
        return withLock(taskId, () -> {
            try (LoggingContext ctx = LoggingContext.forTask(taskId)) {
                Task task = load(taskId);
                if (task.isTerminal()) {
                    return false;
                }
                Optional<TaskLease> lease = leases.acquire(taskId);
                if (lease.isEmpty()) {
                    return false;
                }
                task = update(task.withFenceToken(lease.get().fenceToken()));
                log.info("Resuming task in {}", task.status());
                try {
                    switch (task.status()) {
                        case PENDING, PLANNING -> {
                            Task planningTask = transition(task, TaskStatus.PLANNING);
                            planAndGate(planningTask, new PlanningRequest(taskId, planningTask.intent(),
                                planningTask.roleScope(), planningTask.planVersion() + 1, planningTask.currentPlanId()));
                        }
                        case AWAITING_CONFIRMATION -> {
                            if (tokens.pendingExpiry(taskId).isEmpty()) {
                                // tokens live in memory; ask again under a fresh one
                                Plan plan = currentPlan(task);
                                gateAndProceed(task, plan);
                            }
                        }
                        default -> {
                            Plan plan = currentPlan(task);
                            List<StepResult> results = resultRepository.findByTask(taskId);
                            applyProgress(task, engine.resume(task, plan, results, lastAuthorization(taskId)));
                        }
                    }
                } catch (AuditChainBrokenException e) {
                    fail(load(taskId), FailureReason.AUDIT_INTEGRITY, e.getMessage());
                } catch (OrchestratorException e) {
                    log.warn("Resumed task ended with {}: {}", e.getErrorCode(), e.getMessage());
                }
                return true;
            }
        });
    }

    /**
     * Fail a task whose confirmation window has passed.
     *
     * @return true if the task was failed
     */
    public boolean expireConfirmation(UUID taskId) {
        return withLock(taskId, () -> {
            try (LoggingContext ctx = LoggingContext.forTask(taskId)) {
                Optional<Task> found = taskRepository.findById(taskId);
                if (found.isEmpty() || found.get().status() != TaskStatus.AWAITING_CONFIRMATION) {
                    return false;
                }
                Task task = found.get();
                Instant expiresAt = tokens.pendingExpiry(taskId).orElse(task.updatedAt().plus(tokens.ttl()));
                if (clock.instant().isBefore(expiresAt)) {
                    return false;
                }
                tokens.revoke(taskId);
                fail(task, FailureReason.CONFIRMATION_TIMEOUT,
                    "No confirmation received before " + expiresAt);
                return true;
            }
        });
    }

    /**
     * Drop local state of tasks whose lease was lost.
     */
    public void leasesLost(Iterable<UUID> taskIds) {
        for (UUID taskId : taskIds) {
            engine.forget(taskId);
            log.warn("Stopped driving task {} after losing its lease", taskId);
        }
    }

    // ========== Planning and gating ==========

    private TaskSubmission planAndGate(Task task, PlanningRequest request) {
        Plan plan;
        try {
            plan = planning.plan(request);
        } catch (PlanCycleException e) {
            fail(task, FailureReason.PLAN_CYCLE, e.getMessage());
            throw e;
        } catch (MissingCompensationException e) {
            fail(task, FailureReason.MISSING_COMPENSATION, e.getMessage());
            throw e;
        } catch (PlanValidationException e) {
            fail(task, FailureReason.PLAN_INVALID, e.getMessage());
            throw e;
        }

        planRepository.save(plan);
        Task planned = update(task.withPlan(plan.planId(), plan.version(), clock.instant()));
        publish(Topics.TASK_EVENTS, Topics.MEMORY, MessageType.PLAN_PROPOSED,
            new PlanProposed(plan, planned.intent(), planned.roleScope()), planned.priority(), planned.taskId());
        return gateAndProceed(planned, plan);
    }

    private TaskSubmission gateAndProceed(Task task, Plan plan) {
        GateDecision decision;
        try {
            decision = gate.evaluate(task, plan);
        } catch (AuditChainBrokenException e) {
            fail(task, FailureReason.AUDIT_INTEGRITY, e.getMessage());
            throw e;
        }
        Plan scored = decision.scoredPlan();
        planRepository.updateRiskScores(scored);
        metrics.gateDecision(decision.decision());

        String token = decision.confirmation() != null ? decision.confirmation().token() : null;
        Instant expiresAt = decision.confirmation() != null ? decision.confirmation().expiresAt() : null;
        publish(Topics.TASK_EVENTS, Topics.API, MessageType.SECURITY_DECISION,
            new SecurityDecisionNotice(task.taskId(), plan.planId(), decision.decision(), decision.aggregateRisk(),
                token, expiresAt), task.priority(), task.taskId());

        if (decision.isRejected()) {
            planRepository.updateStatus(plan.planId(), PlanStatus.FAILED);
            RiskExceededException rejection = new RiskExceededException(decision.aggregateRisk(),
                gate.thresholds().high());
            fail(task, FailureReason.RISK_EXCEEDED, rejection.getMessage());
            throw rejection;
        }
        if (decision.requiresConfirmation()) {
            Task waiting = transition(task, TaskStatus.AWAITING_CONFIRMATION);
            log.info("Plan v{} waits for confirmation until {}", plan.version(), expiresAt);
            return new TaskSubmission(waiting.taskId(), waiting.status(), decision.aggregateRisk(),
                token, expiresAt, null);
        }

        planRepository.updateStatus(plan.planId(), PlanStatus.ACCEPTED);
        Task started = startExecution(task, scored, AuditDecision.AUTO_APPROVED);
        return submissionOf(started, decision.aggregateRisk());
    }

    private Task startExecution(Task task, Plan plan, AuditDecision authorization) {
        Task running = transition(task, TaskStatus.RUNNING);
        planRepository.updateStatus(plan.planId(), PlanStatus.RUNNING);
        try {
            return applyProgress(running, engine.start(running, plan, authorization));
        } catch (AuditChainBrokenException e) {
            fail(running, FailureReason.AUDIT_INTEGRITY, e.getMessage());
            throw e;
        }
    }

    // ========== Progress ==========

    private Task applyProgress(Task task, ExecutionProgress progress) {
        if (progress.ignored()) {
            return task;
        }
        if (progress.isTerminal()) {
            return finish(task, progress);
        }
        return transition(task, progress.status());
    }

    private Task finish(Task task, ExecutionProgress progress) {
        Plan plan = currentPlan(task);
        if (progress.status() == TaskStatus.COMPLETED) {
            planRepository.updateStatus(plan.planId(), PlanStatus.COMPLETED);
            Task completed = transition(task, TaskStatus.COMPLETED);
            metrics.taskCompleted(Duration.between(task.createdAt(), clock.instant()));
            leases.release(task.taskId());
            log.info("Task completed");
            return completed;
        }

        TaskFailure failure = progress.failure();
        if (shouldReplan(plan, failure)) {
            return replan(task, plan, failure);
        }
        planRepository.updateStatus(plan.planId(), PlanStatus.FAILED);
        return terminate(task, progress.status(), failure);
    }

    private boolean shouldReplan(Plan plan, TaskFailure failure) {
        return failure != null
            && failure.reason() == FailureReason.STEP_EXECUTION
            && failure.compensationsSucceeded()
            && plan.version() <= replanAttempts;
    }

    private Task replan(Task task, Plan plan, TaskFailure failure) {
        log.info("Plan v{} failed at step {} and was fully rolled back, replanning", plan.version(), failure.stepId());
        planRepository.updateStatus(plan.planId(), PlanStatus.SUPERSEDED);
        metrics.taskReplanned();
        Task planningTask = transition(task, TaskStatus.PLANNING);
        try {
            planAndGate(planningTask, new PlanningRequest(task.taskId(), task.intent(), task.roleScope(),
                plan.version() + 1, plan.planId()));
        } catch (OrchestratorException e) {
            log.warn("Replanning ended the task: {}", e.getMessage());
        }
        return load(task.taskId());
    }

    // ========== State changes ==========

    private Task transition(Task task, TaskStatus target) {
        if (task.status() == target) {
            return task;
        }
        if (!task.status().canTransitionTo(target)) {
            throw new InvalidStateTransitionException(task.status(), target);
        }
        log.debug("Task {} -> {}", task.status(), target);
        return update(task.withStatus(target, clock.instant()));
    }

    private void fail(Task task, FailureReason reason, String message) {
        Task current = load(task.taskId());
        if (current.isTerminal()) {
            return;
        }
        tokens.revoke(task.taskId());
        terminate(current, TaskStatus.FAILED, TaskFailure.of(reason, message));
    }

    private Task terminate(Task task, TaskStatus status, TaskFailure failure) {
        if (!task.status().canTransitionTo(status)) {
            throw new InvalidStateTransitionException(task.status(), status);
        }
        Task terminal = update(task.withFailure(status, failure, clock.instant()));
        Duration elapsed = Duration.between(task.createdAt(), clock.instant());
        if (status == TaskStatus.CANCELLED) {
            metrics.taskCancelled();
        } else {
            metrics.taskFailed(failure.reason(), elapsed);
        }
        leases.release(task.taskId());
        log.info("Task {} ({}): {}, compensation {}", status, failure.reason(), failure.message(),
            failure.completeness());
        return terminal;
    }

    private Task update(Task task) {
        return taskRepository.update(task);
    }

    private Task lease(Task task) {
        Optional<TaskLease> lease = leases.acquire(task.taskId());
        if (lease.isEmpty()) {
            throw new LeaseAcquisitionException(TaskLease.leaseKeyFor(task.taskId()), "held by another instance");
        }
        if (lease.get().fenceToken() == task.fenceToken()) {
            return task;
        }
        return update(task.withFenceToken(lease.get().fenceToken()));
    }

    // ========== Helpers ==========

    private Task load(UUID taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId.toString()));
    }

    private Plan currentPlan(Task task) {
        if (task.currentPlanId() == null) {
            throw new NotFoundException("Plan", "task " + task.taskId());
        }
        return planRepository.findById(task.currentPlanId())
            .orElseThrow(() -> new NotFoundException("Plan", task.currentPlanId().toString()));
    }

    /**
     * The gate decision recorded for the latest plan: CONFIRMED if a human confirmed it.
     */
    private AuditDecision lastAuthorization(UUID taskId) {
        List<AuditEntry> entries = auditLog.entries(taskId);
        for (int i = entries.size() - 1; i >= 0; i--) {
            AuditEntry entry = entries.get(i);
            if (entry.stepId() == null
                    && (entry.decision() == AuditDecision.AUTO_APPROVED || entry.decision() == AuditDecision.CONFIRMED)) {
                return entry.decision();
            }
        }
        return AuditDecision.AUTO_APPROVED;
    }

    private void publish(String topic, String receiver, MessageType type, Object payload, int priority, UUID taskId) {
        bus.publish(topic, MessageEnvelope.create(Topics.ORCHESTRATOR, receiver, type, codec.toPayload(payload),
            priority, taskId.toString(), clock.instant()));
    }

    private <T> T withLock(UUID taskId, Supplier<T> action) {
        return locks.withLock(taskId, action);
    }

    private TaskSubmission submissionOf(Task task, Double aggregateRisk) {
        double risk = aggregateRisk != null ? aggregateRisk : currentRisk(task);
        Instant expiresAt = task.status() == TaskStatus.AWAITING_CONFIRMATION
            ? tokens.pendingExpiry(task.taskId()).orElse(null)
            : null;
        return new TaskSubmission(task.taskId(), task.status(), risk, null, expiresAt, task.failure());
    }

    private double currentRisk(Task task) {
        if (task.currentPlanId() == null) {
            return 0.0;
        }
        return planRepository.findById(task.currentPlanId()).map(Plan::aggregateRiskScore).orElse(0.0);
    }

    private TaskView view(Task task) {
        List<StepResult> results = resultRepository.findByTask(task.taskId());
        PlanSummary plan = null;
        if (task.currentPlanId() != null) {
            plan = planRepository.findById(task.currentPlanId())
                .map(p -> summarize(p, results))
                .orElse(null);
        }
        StepResult lastResult = results.isEmpty() ? null : results.get(results.size() - 1);
        Instant expiresAt = task.status() == TaskStatus.AWAITING_CONFIRMATION
            ? tokens.pendingExpiry(task.taskId()).orElse(null)
            : null;
        return new TaskView(task.taskId(), task.intent(), task.roleScope(), task.priority(), task.status(),
            task.cancelRequested(), task.failure(), plan, lastResult, expiresAt, task.createdAt(), task.updatedAt());
    }

    private static PlanSummary summarize(Plan plan, List<StepResult> results) {
        List<StepSummary> steps = new ArrayList<>();
        for (Step step : plan.steps()) {
            int attempts = 0;
            StepResult last = null;
            boolean compensated = false;
            for (StepResult result : results) {
                if (!plan.planId().equals(result.planId()) || !step.stepId().equals(result.stepId())) {
                    continue;
                }
                if (result.kind() == StepKind.COMPENSATION) {
                    compensated = result.isSuccess();
                } else {
                    attempts = Math.max(attempts, result.attempt());
                    last = result;
                }
            }
            steps.add(new StepSummary(step.stepId(), step.action().name(), step.action().target(),
                step.riskLevel(), step.riskScore(), step.dependsOn(), attempts,
                last != null ? last.outcome() : null, compensated));
        }
        return new PlanSummary(plan.planId(), plan.version(), plan.status(), plan.aggregateRiskScore(),
            plan.contextDegraded(), plan.estimatedDuration(), steps);
    }
}
