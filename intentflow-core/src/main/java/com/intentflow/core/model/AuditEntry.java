package com.intentflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One link of a task's tamper-evident audit chain.
 * {@code hash} covers every other field plus {@code previousHash}.
 */
public record AuditEntry(
    UUID entryId,
    UUID taskId,
    long sequence,
    String stepId,
    String actor,
    String action,
    double riskScore,
    AuditDecision decision,
    Instant timestamp,
    String previousHash,
    String hash
) {
    /** previousHash of the first entry of every chain. */
    public static final String GENESIS_HASH = "0".repeat(64);

    /**
     * Field content covered by the hash, in a fixed order.
     */
    public String canonicalContent() {
        return String.join("|",
            taskId.toString(),
            Long.toString(sequence),
            stepId != null ? stepId : "",
            actor,
            action,
            Double.toString(riskScore),
            decision.name(),
            Long.toString(timestamp.toEpochMilli()),
            previousHash
        );
    }
}
