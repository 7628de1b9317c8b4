package com.intentflow.engine.persistence;

import com.intentflow.core.exception.OptimisticLockException;
import com.intentflow.core.model.AuditEntry;
import com.intentflow.core.repository.AuditRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of AuditRepository.
 */
@Repository
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryAuditRepository implements AuditRepository {

    private final Map<UUID, List<AuditEntry>> chains = new ConcurrentHashMap<>();

    @Override
    public synchronized void append(AuditEntry entry) {
        List<AuditEntry> chain = chains.computeIfAbsent(entry.taskId(), id -> new ArrayList<>());
        if (entry.sequence() != chain.size()) {
            throw new OptimisticLockException("AuditChain", entry.taskId().toString(), chain.size());
        }
        chain.add(entry);
    }

    @Override
    public synchronized List<AuditEntry> findByTask(UUID taskId) {
        return List.copyOf(chains.getOrDefault(taskId, List.of()));
    }

    @Override
    public synchronized Optional<AuditEntry> findLast(UUID taskId) {
        List<AuditEntry> chain = chains.get(taskId);
        return chain == null || chain.isEmpty() ? Optional.empty() : Optional.of(chain.get(chain.size() - 1));
    }
}
