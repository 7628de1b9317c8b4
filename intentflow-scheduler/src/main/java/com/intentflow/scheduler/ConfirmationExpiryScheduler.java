package com.intentflow.scheduler;

import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically fails tasks whose confirmation window has passed.
 *
 * The sweep only finds candidates; whether a task is actually past its window is
 * decided by the {@link ConfirmationExpirer} under the task lock.
 */
public class ConfirmationExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationExpiryScheduler.class);

    private static final int BATCH_SIZE = 100;

    private final TaskRepository taskRepository;
    private final ConfirmationExpirer expirer;
    private final Duration pollInterval;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public ConfirmationExpiryScheduler(TaskRepository taskRepository, ConfirmationExpirer expirer,
                                       Duration pollInterval) {
        this.taskRepository = taskRepository;
        this.expirer = expirer;
        this.pollInterval = pollInterval;
    }

    /**
     * Start the sweeper.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Confirmation expiry scheduler already running");
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "intentflow-confirmation-expiry");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweepSafely,
            pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Confirmation expiry scheduler started (every {})", pollInterval);
    }

    /**
     * Stop the sweeper.
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
        log.info("Confirmation expiry scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Offer every task awaiting confirmation to the expirer.
     *
     * @return Number of tasks failed with a confirmation timeout
     */
    public int sweep() {
        List<Task> waiting = taskRepository.findByStatus(TaskStatus.AWAITING_CONFIRMATION, BATCH_SIZE);
        int expired = 0;
        for (Task task : waiting) {
            try {
                if (expirer.expire(task.taskId())) {
                    expired++;
                    log.info("Confirmation window of task {} elapsed", task.taskId());
                }
            } catch (Exception e) {
                log.error("Failed to expire confirmation of task {}", task.taskId(), e);
            }
        }
        return expired;
    }

    private void sweepSafely() {
        if (!running) return;
        try {
            sweep();
        } catch (Exception e) {
            log.error("Error sweeping confirmations", e);
        }
    }

    /**
     * Fails one task if its confirmation window has passed.
     */
    @FunctionalInterface
    public interface ConfirmationExpirer {
        boolean expire(UUID taskId);
    }
}
