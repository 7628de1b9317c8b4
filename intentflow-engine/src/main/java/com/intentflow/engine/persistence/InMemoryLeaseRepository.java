package com.intentflow.engine.persistence;

import com.intentflow.core.model.TaskLease;
import com.intentflow.core.repository.LeaseRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of LeaseRepository.
 *
 * Fence tokens grow by one on every acquisition and forced release, so a holder
 * that lost its lease can be detected by a token mismatch.
 */
@Repository
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryLeaseRepository implements LeaseRepository {

    private final Map<String, TaskLease> leases = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> fenceTokens = new ConcurrentHashMap<>();

    @Override
    public Optional<TaskLease> tryAcquire(TaskLease lease) {
        synchronized (leases) {
            TaskLease existing = leases.get(lease.leaseKey());
            if (existing != null && existing.isValidAt(lease.acquiredAt())) {
                // still held
                return Optional.empty();
            }
            long token = fenceTokens.computeIfAbsent(lease.leaseKey(), k -> new AtomicLong(0))
                .incrementAndGet();
            TaskLease acquired = lease.withFenceToken(token);
            leases.put(lease.leaseKey(), acquired);
            return Optional.of(acquired);
        }
    }

    @Override
    public boolean renew(String leaseKey, UUID holderId, Instant now, Instant newExpiresAt) {
        synchronized (leases) {
            TaskLease existing = leases.get(leaseKey);
            if (existing == null || !existing.isHeldBy(holderId) || existing.isExpiredAt(now)) {
                return false;
            }
            leases.put(leaseKey, new TaskLease(existing.leaseKey(), existing.taskId(), existing.holderId(),
                existing.holderAddress(), existing.acquiredAt(), newExpiresAt, existing.leaseDuration(),
                existing.renewalCount() + 1, existing.fenceToken()));
            return true;
        }
    }

    @Override
    public boolean release(String leaseKey, UUID holderId) {
        synchronized (leases) {
            TaskLease existing = leases.get(leaseKey);
            if (existing == null || !existing.isHeldBy(holderId)) {
                return false;
            }
            leases.remove(leaseKey);
            return true;
        }
    }

    @Override
    public long forceRelease(String leaseKey) {
        synchronized (leases) {
            leases.remove(leaseKey);
            return fenceTokens.computeIfAbsent(leaseKey, k -> new AtomicLong(0)).incrementAndGet();
        }
    }

    @Override
    public Optional<TaskLease> findByKey(String leaseKey) {
        return Optional.ofNullable(leases.get(leaseKey));
    }

    @Override
    public List<TaskLease> findByHolder(UUID holderId) {
        return leases.values().stream()
            .filter(l -> l.isHeldBy(holderId))
            .toList();
    }

    @Override
    public List<TaskLease> findExpired(Instant now, int limit) {
        return leases.values().stream()
            .filter(l -> l.isExpiredAt(now))
            .sorted(Comparator.comparing(TaskLease::expiresAt))
            .limit(limit)
            .toList();
    }

    @Override
    public boolean validateFenceToken(String leaseKey, long fenceToken) {
        AtomicLong token = fenceTokens.get(leaseKey);
        return token != null && token.get() == fenceToken;
    }
}
