package com.intentflow.engine.coordinator;

import com.intentflow.core.model.TaskLease;
import com.intentflow.core.repository.LeaseRepository;
import com.intentflow.engine.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-task leases held by this orchestrator instance.
 *
 * Only the holder of a task's lease dispatches its steps or applies its results.
 * Every acquisition bumps the fence token, so a former holder whose lease was
 * reclaimed can tell it lost the task.
 */
public class LeaseManager {

    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);

    private final LeaseRepository repository;
    private final UUID holderId;
    private final String holderAddress;
    private final Duration ttl;
    private final Clock clock;
    private final OrchestratorMetrics metrics;
    private final Map<UUID, TaskLease> held = new ConcurrentHashMap<>();

    public LeaseManager(LeaseRepository repository, UUID holderId, String holderAddress, Duration ttl,
                        Clock clock, OrchestratorMetrics metrics) {
        this.repository = repository;
        this.holderId = holderId;
        this.holderAddress = holderAddress;
        this.ttl = ttl;
        this.clock = clock;
        this.metrics = metrics;
    }

    public UUID holderId() {
        return holderId;
    }

    /**
     * Acquire the lease of a task, or return the one already held.
     */
    public Optional<TaskLease> acquire(UUID taskId) {
        if (holds(taskId)) {
            return Optional.of(held.get(taskId));
        }
        Optional<TaskLease> granted = repository.tryAcquire(
            TaskLease.create(taskId, holderId, holderAddress, ttl, clock.instant()));
        metrics.leaseAcquired(granted.isPresent());
        granted.ifPresentOrElse(
            lease -> {
                held.put(taskId, lease);
                log.debug("Acquired lease {} with fence token {}", lease.leaseKey(), lease.fenceToken());
            },
            () -> log.debug("Lease of task {} is held elsewhere", taskId));
        return granted;
    }

    /**
     * Whether this instance holds a live lease for the task with a current fence token.
     */
    public boolean holds(UUID taskId) {
        TaskLease lease = held.get(taskId);
        if (lease == null) {
            return false;
        }
        if (lease.isExpiredAt(clock.instant()) || !repository.validateFenceToken(lease.leaseKey(), lease.fenceToken())) {
            lost(taskId, lease);
            return false;
        }
        return true;
    }

    public Optional<TaskLease> heldLease(UUID taskId) {
        return Optional.ofNullable(held.get(taskId));
    }

    /**
     * Extend every held lease. Leases that cannot be renewed are dropped.
     *
     * @return Ids of tasks whose lease was lost
     */
    public Set<UUID> renewHeld() {
        Set<UUID> lostTasks = ConcurrentHashMap.newKeySet();
        Instant now = clock.instant();
        for (TaskLease lease : held.values()) {
            if (repository.renew(lease.leaseKey(), holderId, now, now.plus(ttl))) {
                held.replace(lease.taskId(), lease, lease.renew(now));
                metrics.leaseRenewed();
            } else {
                lost(lease.taskId(), lease);
                lostTasks.add(lease.taskId());
            }
        }
        return lostTasks;
    }

    public void release(UUID taskId) {
        TaskLease lease = held.remove(taskId);
        if (lease != null) {
            repository.release(lease.leaseKey(), holderId);
            log.debug("Released lease {}", lease.leaseKey());
        }
    }

    /**
     * Release every held lease, e.g. on shutdown.
     *
     * @return Number of leases released
     */
    public int releaseAll() {
        int released = 0;
        for (UUID taskId : Set.copyOf(held.keySet())) {
            release(taskId);
            released++;
        }
        return released;
    }

    public Set<UUID> heldTaskIds() {
        return Set.copyOf(held.keySet());
    }

    private void lost(UUID taskId, TaskLease lease) {
        if (held.remove(taskId, lease)) {
            metrics.leaseLost();
            log.warn("Lost lease {} (fence token {})", lease.leaseKey(), lease.fenceToken());
        }
    }
}
