package com.intentflow.engine.security;

import java.util.UUID;

/**
 * Result of recomputing a task's audit chain. {@code brokenAtSequence} is the first
 * entry whose link or hash does not match, or -1 if the chain is intact.
 */
public record AuditVerification(
    UUID taskId,
    boolean intact,
    int entryCount,
    long brokenAtSequence
) {
    public static AuditVerification intact(UUID taskId, int entryCount) {
        return new AuditVerification(taskId, true, entryCount, -1);
    }

    public static AuditVerification broken(UUID taskId, int entryCount, long sequence) {
        return new AuditVerification(taskId, false, entryCount, sequence);
    }
}
