package com.intentflow.core.repository;

import com.intentflow.core.model.Plan;
import com.intentflow.core.model.PlanStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for plan versions. Steps are stored with their plan and never change.
 */
public interface PlanRepository {

    Plan save(Plan plan);

    /**
     * Move a plan to a new status. Steps and scores are not touched.
     */
    void updateStatus(UUID planId, PlanStatus status);

    /**
     * Replace the risk scores of a plan that has not yet been accepted.
     */
    void updateRiskScores(Plan scoredPlan);

    Optional<Plan> findById(UUID planId);

    /**
     * All plan versions of a task, oldest first.
     */
    List<Plan> findByTask(UUID taskId);
}
