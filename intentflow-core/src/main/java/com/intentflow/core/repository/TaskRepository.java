package com.intentflow.core.repository;

import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for tasks.
 */
public interface TaskRepository {

    /**
     * Insert a new task.
     *
     * @throws com.intentflow.core.exception.DuplicateTaskException if the id is taken
     */
    Task save(Task task);

    /**
     * Update a task if its stored version equals {@code task.version()}.
     *
     * @return The stored task with its version incremented
     * @throws com.intentflow.core.exception.OptimisticLockException on a concurrent update
     */
    Task update(Task task);

    Optional<Task> findById(UUID taskId);

    /**
     * Find tasks in the given status, oldest update first.
     */
    List<Task> findByStatus(TaskStatus status, int limit);

    /**
     * Find tasks that have not reached a terminal status.
     */
    List<Task> findNonTerminal(int limit);
}
