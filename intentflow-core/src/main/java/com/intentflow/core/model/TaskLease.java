package com.intentflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Exclusive, time-bounded right to drive one task.
 *
 * Invariants:
 * - Only one unexpired lease per leaseKey
 * - fenceToken increases on every acquisition
 * - Lease expires automatically if not renewed
 */
public record TaskLease(
    String leaseKey,
    UUID taskId,
    UUID holderId,
    String holderAddress,
    Instant acquiredAt,
    Instant expiresAt,
    Duration leaseDuration,
    int renewalCount,
    long fenceToken
) {
    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(30);

    public static String leaseKeyFor(UUID taskId) {
        return "task:" + taskId;
    }

    /**
     * Create a lease request. The repository assigns the fence token on acquisition.
     */
    public static TaskLease create(UUID taskId, UUID holderId, String holderAddress,
                                   Duration duration, Instant now) {
        return new TaskLease(leaseKeyFor(taskId), taskId, holderId, holderAddress,
            now, now.plus(duration), duration, 0, 0L);
    }

    public boolean isValidAt(Instant now) {
        return expiresAt.isAfter(now);
    }

    public boolean isExpiredAt(Instant now) {
        return !isValidAt(now);
    }

    public Duration remainingTime(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public TaskLease renew(Instant now) {
        return new TaskLease(leaseKey, taskId, holderId, holderAddress, acquiredAt,
            now.plus(leaseDuration), leaseDuration, renewalCount + 1, fenceToken);
    }

    public TaskLease withFenceToken(long token) {
        return new TaskLease(leaseKey, taskId, holderId, holderAddress, acquiredAt,
            expiresAt, leaseDuration, renewalCount, token);
    }

    public boolean isHeldBy(UUID holder) {
        return holderId != null && holderId.equals(holder);
    }
}
