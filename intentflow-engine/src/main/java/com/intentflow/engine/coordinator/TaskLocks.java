package com.intentflow.engine.coordinator;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of reentrant locks that serializes work per task.
 * Tasks hashing to the same stripe share a lock, so memory stays constant
 * no matter how many tasks pass through.
 */
public final class TaskLocks {

    public static final int DEFAULT_STRIPES = 256;

    private final ReentrantLock[] stripes;

    public TaskLocks() {
        this(DEFAULT_STRIPES);
    }

    public TaskLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(UUID taskId, Supplier<T> action) {
        ReentrantLock lock = lockFor(taskId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(UUID taskId) {
        return stripes[Math.floorMod(taskId.hashCode(), stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }
}
