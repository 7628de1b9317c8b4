package com.intentflow.core.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A single delegated unit of work inside a plan.
 *
 * Invariants:
 * - stepId is unique within its plan
 * - dependsOn only names steps of the same plan
 * - a side-effecting step at MEDIUM risk or above defines a compensatingAction
 */
public record Step(
    String stepId,
    UUID planId,
    int sequenceIndex,
    Set<String> dependsOn,
    ActionDescriptor action,
    RiskLevel riskLevel,
    double riskScore,
    ActionDescriptor compensatingAction,
    RetryPolicy retryPolicy,
    Duration estimatedDuration,
    boolean parallelSafe
) {
    public Step {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(action, "action");
        dependsOn = dependsOn != null ? Set.copyOf(dependsOn) : Set.of();
        riskLevel = riskLevel != null ? riskLevel : action.category().riskLevel();
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        estimatedDuration = estimatedDuration != null ? estimatedDuration : action.category().defaultDuration();
    }

    public boolean hasCompensation() {
        return compensatingAction != null;
    }

    public boolean hasSideEffects() {
        return action.category().hasSideEffects();
    }

    public Step withPlacement(UUID planId, int sequenceIndex) {
        return new Step(stepId, planId, sequenceIndex, dependsOn, action, riskLevel, riskScore,
            compensatingAction, retryPolicy, estimatedDuration, parallelSafe);
    }

    public Step withRiskScore(double riskScore) {
        return new Step(stepId, planId, sequenceIndex, dependsOn, action, riskLevel, riskScore,
            compensatingAction, retryPolicy, estimatedDuration, parallelSafe);
    }

    public static Builder builder(String stepId, ActionDescriptor action) {
        return new Builder(stepId, action);
    }

    public static class Builder {
        private final String stepId;
        private final ActionDescriptor action;
        private UUID planId;
        private int sequenceIndex;
        private Set<String> dependsOn = Set.of();
        private RiskLevel riskLevel;
        private double riskScore;
        private ActionDescriptor compensatingAction;
        private RetryPolicy retryPolicy;
        private Duration estimatedDuration;
        private boolean parallelSafe;

        private Builder(String stepId, ActionDescriptor action) {
            this.stepId = stepId;
            this.action = action;
        }

        public Builder planId(UUID planId) {
            this.planId = planId;
            return this;
        }

        public Builder sequenceIndex(int sequenceIndex) {
            this.sequenceIndex = sequenceIndex;
            return this;
        }

        public Builder dependsOn(Set<String> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder dependsOn(String... stepIds) {
            this.dependsOn = Set.of(stepIds);
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder riskScore(double riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder compensatingAction(ActionDescriptor compensatingAction) {
            this.compensatingAction = compensatingAction;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder parallelSafe(boolean parallelSafe) {
            this.parallelSafe = parallelSafe;
            return this;
        }

        public Step build() {
            return new Step(stepId, planId, sequenceIndex, dependsOn, action, riskLevel, riskScore,
                compensatingAction, retryPolicy, estimatedDuration, parallelSafe);
        }
    }
}
