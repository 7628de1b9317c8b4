package com.intentflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An ordered, dependency-annotated set of steps derived from one intent.
 * Steps are held in topological order. A plan is never mutated once accepted:
 * only its status moves forward, and replanning produces a new version.
 */
public record Plan(
    UUID planId,
    UUID taskId,
    int version,
    List<Step> steps,
    Duration estimatedDuration,
    double aggregateRiskScore,
    PlanStatus status,
    boolean contextDegraded,
    UUID supersedesPlanId,
    Instant createdAt
) {
    public Plan {
        Objects.requireNonNull(planId, "planId");
        Objects.requireNonNull(taskId, "taskId");
        steps = steps != null ? List.copyOf(steps) : List.of();
        status = status != null ? status : PlanStatus.PROPOSED;
    }

    public Optional<Step> step(String stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }

    public Plan withStatus(PlanStatus newStatus) {
        return new Plan(planId, taskId, version, steps, estimatedDuration, aggregateRiskScore,
            newStatus, contextDegraded, supersedesPlanId, createdAt);
    }

    /**
     * Attach the security gate's per-step scores and the aggregate plan risk.
     */
    public Plan withRiskScores(Map<String, Double> stepScores, double aggregate) {
        List<Step> scored = steps.stream()
            .map(s -> s.withRiskScore(stepScores.getOrDefault(s.stepId(), s.riskScore())))
            .toList();
        return new Plan(planId, taskId, version, scored, estimatedDuration, aggregate,
            status, contextDegraded, supersedesPlanId, createdAt);
    }
}
