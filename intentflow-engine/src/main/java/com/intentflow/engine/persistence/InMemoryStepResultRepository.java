package com.intentflow.engine.persistence;

import com.intentflow.core.model.StepResult;
import com.intentflow.core.repository.StepResultRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StepResultRepository. Results are append-only and keyed
 * by their dedup key.
 */
@Repository
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStepResultRepository implements StepResultRepository {

    private final Map<String, StepResult> byKey = new ConcurrentHashMap<>();
    private final Map<UUID, List<StepResult>> byTask = new ConcurrentHashMap<>();

    @Override
    public synchronized boolean append(StepResult result) {
        if (byKey.putIfAbsent(result.dedupKey(), result) != null) {
            return false;
        }
        byTask.computeIfAbsent(result.taskId(), id -> new ArrayList<>()).add(result);
        return true;
    }

    @Override
    public synchronized List<StepResult> findByTask(UUID taskId) {
        return List.copyOf(byTask.getOrDefault(taskId, List.of()));
    }

    @Override
    public boolean exists(String dedupKey) {
        return byKey.containsKey(dedupKey);
    }
}
