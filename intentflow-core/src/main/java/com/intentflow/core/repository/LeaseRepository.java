package com.intentflow.core.repository;

import com.intentflow.core.model.TaskLease;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for per-task execution leases.
 */
public interface LeaseRepository {

    /**
     * Try to acquire a lease. Succeeds when no lease exists for the key or the
     * existing one expired before {@code lease.acquiredAt()}.
     *
     * @param lease The lease request
     * @return The granted lease with its new fence token, or empty if held by someone else
     */
    Optional<TaskLease> tryAcquire(TaskLease lease);

    /**
     * Renew a lease held by the given holder.
     *
     * @return true if renewed, false if the lease is gone or held by someone else
     */
    boolean renew(String leaseKey, UUID holderId, Instant now, Instant newExpiresAt);

    /**
     * Release a lease held by the given holder.
     */
    boolean release(String leaseKey, UUID holderId);

    /**
     * Drop a lease regardless of holder and bump its fence token.
     *
     * @return The new fence token
     */
    long forceRelease(String leaseKey);

    Optional<TaskLease> findByKey(String leaseKey);

    List<TaskLease> findByHolder(UUID holderId);

    /**
     * Find held leases that expired before {@code now}, oldest first.
     */
    List<TaskLease> findExpired(Instant now, int limit);

    /**
     * Check that a fence token is still the current one for a lease.
     */
    boolean validateFenceToken(String leaseKey, long fenceToken);
}
