package com.intentflow.engine.lifecycle;

import com.intentflow.engine.coordinator.LeaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown of one IntentFlow process.
 *
 * On shutdown:
 * 1. Stops accepting new tasks
 * 2. Stops every registered component in registration order (agents, then background loops)
 * 3. Releases all task leases held by this process so another instance can resume them
 *    without waiting for expiry
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final LeaseManager leaseManager;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final List<NamedStop> components = new ArrayList<>();

    public GracefulShutdownHandler(LeaseManager leaseManager) {
        this.leaseManager = leaseManager;
    }

    /**
     * Register a component to stop on shutdown.
     */
    public synchronized void register(String name, Runnable stopAction) {
        components.add(new NamedStop(name, stopAction));
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Check if new tasks can be accepted.
     */
    public boolean canAcceptTasks() {
        return !shuttingDown.get();
    }

    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    /**
     * Run the shutdown sequence once. Later calls do nothing.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown for holder: {}", leaseManager.holderId());

        stopComponents();

        int released = leaseManager.releaseAll();
        log.info("Graceful shutdown complete, released {} leases", released);
    }

    private void stopComponents() {
        List<NamedStop> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(components);
        }
        for (NamedStop component : snapshot) {
            try {
                component.stopAction().run();
                log.debug("Stopped {}", component.name());
            } catch (RuntimeException e) {
                log.error("Failed to stop {}: {}", component.name(), e.getMessage(), e);
            }
        }
    }

    private record NamedStop(String name, Runnable stopAction) {
    }
}
