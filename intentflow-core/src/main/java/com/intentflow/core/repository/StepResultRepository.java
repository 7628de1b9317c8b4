package com.intentflow.core.repository;

import com.intentflow.core.model.StepResult;

import java.util.List;
import java.util.UUID;

/**
 * Append-only store of step results, unique on the deduplication key.
 */
public interface StepResultRepository {

    /**
     * Append a result.
     *
     * @return false if a result with the same deduplication key was already stored
     */
    boolean append(StepResult result);

    /**
     * All results of a task in the order they were appended.
     */
    List<StepResult> findByTask(UUID taskId);

    boolean exists(String dedupKey);
}
