package com.intentflow.engine.coordinator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskLocksTest {

    @Test
    @DisplayName("Any number of tasks maps onto the fixed stripe set")
    void shouldKeepLockCountBounded() {
        TaskLocks locks = new TaskLocks(16);
        Set<ReentrantLock> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        for (int i = 0; i < 10_000; i++) {
            seen.add(locks.lockFor(UUID.randomUUID()));
        }

        assertThat(seen).hasSizeLessThanOrEqualTo(locks.stripeCount());
    }

    @Test
    @DisplayName("The same task always resolves to the same lock")
    void shouldResolveStableLock() {
        TaskLocks locks = new TaskLocks();
        UUID taskId = UUID.randomUUID();

        assertThat(locks.lockFor(taskId)).isSameAs(locks.lockFor(UUID.fromString(taskId.toString())));
    }

    @Test
    @DisplayName("Work on one task is serialized across threads")
    void shouldSerializeWorkOnSameTask() throws Exception {
        TaskLocks locks = new TaskLocks();
        UUID taskId = UUID.randomUUID();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 200; n++) {
                        locks.withLock(taskId, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            inside.decrementAndGet();
                            return null;
                        });
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Re-entering the lock from the same thread does not block")
    void shouldAllowReentry() {
        TaskLocks locks = new TaskLocks(1);

        String result = locks.withLock(UUID.randomUUID(), () -> locks.withLock(UUID.randomUUID(), () -> "done"));

        assertThat(result).isEqualTo("done");
    }

    @Test
    void shouldRejectNonPositiveStripeCount() {
        assertThatThrownBy(() -> new TaskLocks(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
