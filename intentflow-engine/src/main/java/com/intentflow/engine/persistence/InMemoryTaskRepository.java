package com.intentflow.engine.persistence;

import com.intentflow.core.exception.DuplicateTaskException;
import com.intentflow.core.exception.NotFoundException;
import com.intentflow.core.exception.OptimisticLockException;
import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.core.repository.TaskRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TaskRepository.
 * For single-node deployments and tests.
 */
@Repository
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<UUID, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public Task save(Task task) {
        synchronized (tasks) {
            if (tasks.containsKey(task.taskId())) {
                throw new DuplicateTaskException(task.taskId());
            }
            Task stored = task.withVersion(0);
            tasks.put(task.taskId(), stored);
            return stored;
        }
    }

    @Override
    public Task update(Task task) {
        synchronized (tasks) {
            Task existing = tasks.get(task.taskId());
            if (existing == null) {
                throw new NotFoundException("Task", task.taskId().toString());
            }
            if (existing.version() != task.version()) {
                throw new OptimisticLockException("Task", task.taskId().toString(), task.version());
            }
            Task stored = task.withVersion(task.version() + 1);
            tasks.put(task.taskId(), stored);
            return stored;
        }
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> findByStatus(TaskStatus status, int limit) {
        return tasks.values().stream()
            .filter(t -> t.status() == status)
            .sorted(Comparator.comparing(Task::createdAt))
            .limit(limit)
            .toList();
    }

    @Override
    public List<Task> findNonTerminal(int limit) {
        return tasks.values().stream()
            .filter(t -> !t.isTerminal())
            .sorted(Comparator.comparing(Task::createdAt))
            .limit(limit)
            .toList();
    }
}
