package com.intentflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TaskLeaseTest {

    private final Instant now = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void create_shouldKeyLeaseByTask() {
        UUID taskId = UUID.randomUUID();
        UUID holderId = UUID.randomUUID();

        TaskLease lease = TaskLease.create(taskId, holderId, "node-1", Duration.ofSeconds(30), now);

        assertEquals("task:" + taskId, lease.leaseKey());
        assertEquals(now.plusSeconds(30), lease.expiresAt());
        assertEquals(0, lease.renewalCount());
        assertTrue(lease.isHeldBy(holderId));
        assertTrue(lease.isValidAt(now));
    }

    @Test
    void isExpiredAt_shouldBeTrueOnceTtlElapsed() {
        TaskLease lease = TaskLease.create(UUID.randomUUID(), UUID.randomUUID(), "node-1",
            Duration.ofSeconds(30), now);

        assertFalse(lease.isExpiredAt(now.plusSeconds(29)));
        assertTrue(lease.isExpiredAt(now.plusSeconds(30)));
        assertEquals(Duration.ZERO, lease.remainingTime(now.plusSeconds(60)));
    }

    @Test
    void renew_shouldExtendFromRenewalTime() {
        TaskLease lease = TaskLease.create(UUID.randomUUID(), UUID.randomUUID(), "node-1",
            Duration.ofSeconds(30), now).withFenceToken(7L);

        TaskLease renewed = lease.renew(now.plusSeconds(20));

        assertEquals(now.plusSeconds(50), renewed.expiresAt());
        assertEquals(1, renewed.renewalCount());
        assertEquals(7L, renewed.fenceToken());
        assertEquals(lease.acquiredAt(), renewed.acquiredAt());
    }
}
