package com.intentflow.engine.persistence;

import com.intentflow.core.exception.NotFoundException;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.PlanStatus;
import com.intentflow.core.repository.PlanRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PlanRepository.
 */
@Repository
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryPlanRepository implements PlanRepository {

    private final Map<UUID, Plan> plans = new ConcurrentHashMap<>();

    @Override
    public Plan save(Plan plan) {
        plans.put(plan.planId(), plan);
        return plan;
    }

    @Override
    public void updateStatus(UUID planId, PlanStatus status) {
        Plan updated = plans.computeIfPresent(planId, (id, plan) -> plan.withStatus(status));
        if (updated == null) {
            throw new NotFoundException("Plan", planId.toString());
        }
    }

    @Override
    public void updateRiskScores(Plan scoredPlan) {
        if (plans.replace(scoredPlan.planId(), scoredPlan) == null) {
            throw new NotFoundException("Plan", scoredPlan.planId().toString());
        }
    }

    @Override
    public Optional<Plan> findById(UUID planId) {
        return Optional.ofNullable(plans.get(planId));
    }

    @Override
    public List<Plan> findByTask(UUID taskId) {
        return plans.values().stream()
            .filter(p -> p.taskId().equals(taskId))
            .sorted(Comparator.comparingInt(Plan::version))
            .toList();
    }
}
