package com.intentflow.core.repository;

import com.intentflow.core.model.AuditEntry;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only audit log, one hash chain per task.
 */
public interface AuditRepository {

    /**
     * Append the next link of a task's chain.
     *
     * @throws com.intentflow.core.exception.OptimisticLockException if the sequence number is taken
     */
    void append(AuditEntry entry);

    /**
     * Entries of a task ordered by sequence.
     */
    List<AuditEntry> findByTask(UUID taskId);

    Optional<AuditEntry> findLast(UUID taskId);
}
