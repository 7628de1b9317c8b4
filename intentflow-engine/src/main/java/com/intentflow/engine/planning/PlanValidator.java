package com.intentflow.engine.planning;

import com.intentflow.core.exception.MissingCompensationException;
import com.intentflow.core.exception.PlanCycleException;
import com.intentflow.core.exception.PlanValidationException;
import com.intentflow.core.model.RiskLevel;
import com.intentflow.core.model.Step;
import com.intentflow.core.spi.CapabilityRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Structural checks a plan must pass before it reaches the security gate.
 *
 * Order of checks: shape (non-empty, unique ids, known dependencies), acyclicity,
 * compensation coverage, then executor capability.
 */
public class PlanValidator {

    private final CapabilityRegistry capabilities;

    public PlanValidator(CapabilityRegistry capabilities) {
        this.capabilities = capabilities;
    }

    /**
     * Validate the steps and return them in topological order with sequence indexes
     * reassigned. Among steps that are ready at the same time the one listed first wins.
     *
     * @throws PlanValidationException on malformed input or an unsupported action
     * @throws PlanCycleException if dependencies form a cycle
     * @throws MissingCompensationException if a side-effecting step at MEDIUM risk or above has no compensation
     */
    public List<Step> validate(List<Step> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new PlanValidationException("steps", "plan has no steps");
        }

        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            if (position.putIfAbsent(steps.get(i).stepId(), i) != null) {
                throw new PlanValidationException("steps", "duplicate step id " + steps.get(i).stepId());
            }
        }
        for (Step step : steps) {
            for (String dependency : step.dependsOn()) {
                if (!position.containsKey(dependency)) {
                    throw new PlanValidationException("steps[" + step.stepId() + "].dependsOn",
                        "unknown step " + dependency);
                }
            }
        }

        List<Step> ordered = topologicalOrder(steps, position);

        for (Step step : ordered) {
            if (step.hasSideEffects() && step.riskLevel().isAtLeast(RiskLevel.MEDIUM) && !step.hasCompensation()) {
                throw new MissingCompensationException(step.stepId(), step.action().name());
            }
        }

        for (Step step : ordered) {
            if (!capabilities.supports(step.action())) {
                throw new PlanValidationException("steps[" + step.stepId() + "].action",
                    "no executor supports " + step.action().category() + "/" + step.action().name());
            }
            if (step.hasCompensation() && !capabilities.supports(step.compensatingAction())) {
                throw new PlanValidationException("steps[" + step.stepId() + "].compensatingAction",
                    "no executor supports " + step.compensatingAction().category() + "/"
                        + step.compensatingAction().name());
            }
        }

        List<Step> indexed = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            indexed.add(ordered.get(i).withPlacement(ordered.get(i).planId(), i));
        }
        return indexed;
    }

    private static List<Step> topologicalOrder(List<Step> steps, Map<String, Integer> position) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<Step>> dependents = new HashMap<>();
        for (Step step : steps) {
            inDegree.put(step.stepId(), step.dependsOn().size());
            for (String dependency : step.dependsOn()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(step);
            }
        }

        PriorityQueue<Step> ready = new PriorityQueue<>(Comparator.comparingInt(s -> position.get(s.stepId())));
        for (Step step : steps) {
            if (step.dependsOn().isEmpty()) {
                ready.add(step);
            }
        }

        List<Step> ordered = new ArrayList<>(steps.size());
        while (!ready.isEmpty()) {
            Step next = ready.poll();
            ordered.add(next);
            for (Step dependent : dependents.getOrDefault(next.stepId(), List.of())) {
                if (inDegree.merge(dependent.stepId(), -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() < steps.size()) {
            Set<String> placed = new HashSet<>();
            ordered.forEach(s -> placed.add(s.stepId()));
            List<String> cyclic = steps.stream()
                .map(Step::stepId)
                .filter(id -> !placed.contains(id))
                .sorted()
                .toList();
            throw new PlanCycleException(cyclic);
        }
        return ordered;
    }

    /**
     * Length of the longest dependency chain, summing estimated durations.
     */
    public static Duration criticalPath(List<Step> orderedSteps) {
        Map<String, Duration> finish = new HashMap<>();
        Duration longest = Duration.ZERO;
        for (Step step : orderedSteps) {
            Duration start = Duration.ZERO;
            for (String dependency : step.dependsOn()) {
                Duration end = finish.getOrDefault(dependency, Duration.ZERO);
                if (end.compareTo(start) > 0) {
                    start = end;
                }
            }
            Duration end = start.plus(step.estimatedDuration());
            finish.put(step.stepId(), end);
            if (end.compareTo(longest) > 0) {
                longest = end;
            }
        }
        return longest;
    }
}
