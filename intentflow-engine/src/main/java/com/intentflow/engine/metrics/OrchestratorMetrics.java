package com.intentflow.engine.metrics;

import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.FailureReason;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for task orchestration.
 *
 * Metrics exposed:
 * - Task outcomes and end-to-end duration
 * - Security gate decisions
 * - Step dispatches, outcomes, retries and compensations
 * - Duplicate deliveries that were ignored
 * - Lease acquisitions, renewals and losses
 */
@Component
public class OrchestratorMetrics {

    public static final String TASKS_SUBMITTED = "intentflow.tasks.submitted";
    public static final String TASKS_COMPLETED = "intentflow.tasks.completed";
    public static final String TASKS_FAILED = "intentflow.tasks.failed";
    public static final String TASKS_CANCELLED = "intentflow.tasks.cancelled";
    public static final String TASKS_REPLANNED = "intentflow.tasks.replanned";
    public static final String TASK_DURATION = "intentflow.tasks.duration";

    public static final String GATE_DECISIONS = "intentflow.gate.decisions";

    public static final String STEPS_DISPATCHED = "intentflow.steps.dispatched";
    public static final String STEP_RESULTS = "intentflow.steps.results";
    public static final String STEP_RETRIES = "intentflow.steps.retries";
    public static final String COMPENSATIONS = "intentflow.compensations";

    public static final String BUS_DUPLICATES = "intentflow.bus.duplicates";

    public static final String LEASE_ACQUISITIONS = "intentflow.lease.acquisitions";
    public static final String LEASE_RENEWALS = "intentflow.lease.renewals";
    public static final String LEASE_LOST = "intentflow.lease.lost";

    private final MeterRegistry registry;

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ========== Task Metrics ==========

    public void taskSubmitted() {
        Counter.builder(TASKS_SUBMITTED)
            .description("Total tasks submitted")
            .register(registry)
            .increment();
    }

    public void taskCompleted(Duration duration) {
        Counter.builder(TASKS_COMPLETED)
            .description("Total tasks completed successfully")
            .register(registry)
            .increment();
        Timer.builder(TASK_DURATION)
            .tag("outcome", "completed")
            .description("Time from submission to terminal state")
            .register(registry)
            .record(duration);
    }

    public void taskFailed(FailureReason reason, Duration duration) {
        Counter.builder(TASKS_FAILED)
            .tag("reason", reason.name())
            .description("Total tasks failed")
            .register(registry)
            .increment();
        Timer.builder(TASK_DURATION)
            .tag("outcome", "failed")
            .description("Time from submission to terminal state")
            .register(registry)
            .record(duration);
    }

    public void taskCancelled() {
        Counter.builder(TASKS_CANCELLED)
            .description("Total tasks cancelled")
            .register(registry)
            .increment();
    }

    public void taskReplanned() {
        Counter.builder(TASKS_REPLANNED)
            .description("New plan versions created after an unrecoverable failure")
            .register(registry)
            .increment();
    }

    public void gateDecision(AuditDecision decision) {
        Counter.builder(GATE_DECISIONS)
            .tag("decision", decision.name())
            .description("Security gate decisions")
            .register(registry)
            .increment();
    }

    // ========== Step Metrics ==========

    public void stepDispatched(StepKind kind) {
        Counter.builder(STEPS_DISPATCHED)
            .tag("kind", kind.name())
            .description("Step attempts dispatched to execution agents")
            .register(registry)
            .increment();
    }

    public void stepResult(StepKind kind, StepOutcome outcome) {
        Counter.builder(STEP_RESULTS)
            .tag("kind", kind.name())
            .tag("outcome", outcome.name())
            .description("Step results applied")
            .register(registry)
            .increment();
    }

    public void stepRetried() {
        Counter.builder(STEP_RETRIES)
            .description("Step attempts scheduled for retry")
            .register(registry)
            .increment();
    }

    public void compensation(boolean succeeded) {
        Counter.builder(COMPENSATIONS)
            .tag("outcome", succeeded ? "success" : "failed")
            .description("Compensating actions completed")
            .register(registry)
            .increment();
    }

    public void duplicateIgnored() {
        Counter.builder(BUS_DUPLICATES)
            .description("Step results ignored because their key was already applied")
            .register(registry)
            .increment();
    }

    // ========== Lease Metrics ==========

    public void leaseAcquired(boolean success) {
        Counter.builder(LEASE_ACQUISITIONS)
            .tag("success", String.valueOf(success))
            .description("Task lease acquisition attempts")
            .register(registry)
            .increment();
    }

    public void leaseRenewed() {
        Counter.builder(LEASE_RENEWALS)
            .description("Task lease renewals")
            .register(registry)
            .increment();
    }

    public void leaseLost() {
        Counter.builder(LEASE_LOST)
            .description("Held leases that could not be renewed")
            .register(registry)
            .increment();
    }
}
