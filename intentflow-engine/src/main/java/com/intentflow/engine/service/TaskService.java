package com.intentflow.engine.service;

import com.intentflow.core.model.AuditEntry;
import com.intentflow.core.model.PlanStatus;
import com.intentflow.core.model.RiskLevel;
import com.intentflow.core.model.StepOutcome;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.model.TaskFailure;
import com.intentflow.core.model.TaskRequest;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.engine.security.AuditVerification;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Caller-facing task operations.
 */
public interface TaskService {

    /**
     * Submit an intent. Idempotent on {@link TaskRequest#taskId()}.
     *
     * @return Where the task stands once it has been planned and gated
     * @throws com.intentflow.core.exception.PlanCycleException if the plan has cyclic dependencies
     * @throws com.intentflow.core.exception.MissingCompensationException if a risky step cannot be undone
     * @throws com.intentflow.core.exception.RiskExceededException if the plan is too risky to run
     */
    TaskSubmission submitTask(TaskRequest request);

    /**
     * Confirm a plan that waits for a human.
     *
     * @throws com.intentflow.core.exception.InvalidConfirmationException if the token does not match
     * @throws com.intentflow.core.exception.ConfirmationTimeoutException if the token expired; the task fails
     */
    TaskView confirm(UUID taskId, String confirmationToken, String actor);

    /**
     * Ask for a task to be cancelled. Cancellation happens asynchronously.
     */
    void requestCancel(UUID taskId, String reason);

    /**
     * Cancel a task now: stop dispatching and compensate what already ran.
     */
    TaskView cancel(UUID taskId, String reason);

    void submitFeedback(UUID taskId, int humanRating, String correctionNotes);

    TaskView getTask(UUID taskId);

    List<TaskView> findTasks(TaskStatus status, int limit);

    AuditTrail auditTrail(UUID taskId);

    /**
     * Result of a submission. The confirmation token is present while the plan waits
     * for a human.
     */
    record TaskSubmission(
        UUID taskId,
        TaskStatus status,
        double aggregateRisk,
        String confirmationToken,
        Instant confirmationExpiresAt,
        TaskFailure failure
    ) {}

    record TaskView(
        UUID taskId,
        String intent,
        String roleScope,
        int priority,
        TaskStatus status,
        boolean cancelRequested,
        TaskFailure failure,
        PlanSummary plan,
        StepResult lastResult,
        Instant confirmationExpiresAt,
        Instant createdAt,
        Instant updatedAt
    ) {}

    record PlanSummary(
        UUID planId,
        int version,
        PlanStatus status,
        double aggregateRisk,
        boolean contextDegraded,
        Duration estimatedDuration,
        List<StepSummary> steps
    ) {}

    record StepSummary(
        String stepId,
        String action,
        String target,
        RiskLevel riskLevel,
        double riskScore,
        Set<String> dependsOn,
        int attempts,
        StepOutcome lastOutcome,
        boolean compensated
    ) {}

    record AuditTrail(
        UUID taskId,
        List<AuditEntry> entries,
        AuditVerification verification
    ) {}
}
