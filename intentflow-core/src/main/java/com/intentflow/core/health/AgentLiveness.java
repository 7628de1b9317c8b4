package com.intentflow.core.health;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks message processing of one agent and derives its liveness.
 * An agent is degraded after a failed message and down once failures pile up
 * or it has been stopped.
 */
public class AgentLiveness implements HealthReporter {

    private static final int DOWN_AFTER_CONSECUTIVE_FAILURES = 5;

    private final String agentId;
    private final Clock clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Instant lastProcessedAt;
    private volatile String lastError;
    private volatile boolean running;

    public AgentLiveness(String agentId, Clock clock) {
        this.agentId = agentId;
        this.clock = clock;
    }

    public void started() {
        running = true;
    }

    public void stopped() {
        running = false;
    }

    public void processed() {
        lastProcessedAt = clock.instant();
        consecutiveFailures.set(0);
        lastError = null;
    }

    public void failed(Throwable error) {
        lastProcessedAt = clock.instant();
        consecutiveFailures.incrementAndGet();
        lastError = error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    /**
     * Mark the agent degraded without a processing failure, e.g. a dependency timed out.
     */
    public void degraded(String reason) {
        consecutiveFailures.compareAndSet(0, 1);
        lastError = reason;
    }

    @Override
    public AgentHealth health() {
        HealthStatus status;
        int failures = consecutiveFailures.get();
        if (!running || failures >= DOWN_AFTER_CONSECUTIVE_FAILURES) {
            status = HealthStatus.DOWN;
        } else if (failures > 0) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.OK;
        }
        String detail = !running ? "stopped" : lastError;
        return new AgentHealth(agentId, status, lastProcessedAt, detail);
    }
}
