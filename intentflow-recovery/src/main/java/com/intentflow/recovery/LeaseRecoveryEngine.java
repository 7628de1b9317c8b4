package com.intentflow.recovery;

import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskLease;
import com.intentflow.core.repository.LeaseRepository;
import com.intentflow.core.repository.TaskRepository;
import com.intentflow.engine.coordinator.LeaseManager;
import com.intentflow.engine.coordinator.TaskOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps this instance's task leases alive and takes over tasks nobody drives.
 *
 * Responsibilities:
 * - Renew held leases; stop driving tasks whose lease was lost
 * - Find non-terminal tasks whose lease expired or was released and resume them here
 */
public class LeaseRecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(LeaseRecoveryEngine.class);

    private static final int BATCH_SIZE = 100;

    private final LeaseManager leaseManager;
    private final LeaseRepository leaseRepository;
    private final TaskRepository taskRepository;
    private final TaskOrchestrator orchestrator;
    private final Clock clock;
    private final Duration renewInterval;
    private final Duration recoveryInterval;
    private final Duration leaseTtl;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public LeaseRecoveryEngine(
            LeaseManager leaseManager,
            LeaseRepository leaseRepository,
            TaskRepository taskRepository,
            TaskOrchestrator orchestrator,
            Clock clock,
            Duration renewInterval,
            Duration recoveryInterval,
            Duration leaseTtl) {
        this.leaseManager = leaseManager;
        this.leaseRepository = leaseRepository;
        this.taskRepository = taskRepository;
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.renewInterval = renewInterval;
        this.recoveryInterval = recoveryInterval;
        this.leaseTtl = leaseTtl;
    }

    /**
     * Start renewal and recovery on background threads.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }
        running = true;
        scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread thread = new Thread(r, "intentflow-recovery");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::renewSafely,
            renewInterval.toMillis(), renewInterval.toMillis(), TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::recoverSafely,
            recoveryInterval.toMillis(), recoveryInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Recovery engine started (renew every {}, scan every {})", renewInterval, recoveryInterval);
    }

    /**
     * Stop the background threads. Held leases are left to the shutdown handler.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Renew every lease this instance holds.
     *
     * @return Ids of tasks whose lease could not be renewed
     */
    public Set<UUID> renewLeases() {
        Set<UUID> lost = leaseManager.renewHeld();
        if (!lost.isEmpty()) {
            log.warn("Lost {} task leases during renewal", lost.size());
            orchestrator.leasesLost(lost);
        }
        return lost;
    }

    /**
     * Resume non-terminal tasks that no live lease protects.
     *
     * A task that never carried a fence token and has no lease row is only considered
     * once it has been idle for a full lease TTL, so a submission still in flight on
     * another instance is left alone.
     *
     * @return Number of tasks this instance took over
     */
    public int recoverStaleTasks() {
        Instant now = clock.instant();
        List<Task> candidates = taskRepository.findNonTerminal(BATCH_SIZE);
        int resumed = 0;
        for (Task task : candidates) {
            if (!isOrphaned(task, now)) {
                continue;
            }
            try {
                if (orchestrator.resumeTask(task.taskId())) {
                    resumed++;
                    log.info("Took over task {} in {}", task.taskId(), task.status());
                }
            } catch (Exception e) {
                log.error("Failed to resume task {}", task.taskId(), e);
            }
        }
        return resumed;
    }

    private boolean isOrphaned(Task task, Instant now) {
        if (leaseManager.holds(task.taskId())) {
            return false;
        }
        Optional<TaskLease> lease = leaseRepository.findByKey(TaskLease.leaseKeyFor(task.taskId()));
        if (lease.isEmpty()) {
            return task.fenceToken() > 0 || !task.updatedAt().plus(leaseTtl).isAfter(now);
        }
        return lease.get().holderId() == null || lease.get().isExpiredAt(now);
    }

    private void renewSafely() {
        if (!running) return;
        try {
            renewLeases();
        } catch (Exception e) {
            log.error("Error renewing leases", e);
        }
    }

    private void recoverSafely() {
        if (!running) return;
        try {
            int resumed = recoverStaleTasks();
            if (resumed > 0) {
                log.info("Recovered {} tasks", resumed);
            }
        } catch (Exception e) {
            log.error("Error in lease recovery", e);
        }
    }
}
