package com.intentflow.engine.security;

import com.intentflow.core.exception.AuditChainBrokenException;
import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.AuditEntry;
import com.intentflow.core.repository.AuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-task append-only audit chain.
 *
 * Each entry stores the hash of its predecessor (zeros for the first one) and its own
 * SHA-256 over {@link AuditEntry#canonicalContent()}. Changing or removing any entry
 * breaks every link after it, which {@link #verify} detects.
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final AuditRepository repository;
    private final Clock clock;

    public AuditLog(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Append an entry to the task's chain.
     *
     * @param stepId Step the entry is about, or null for plan-level decisions
     * @return The stored entry with its hash
     */
    public synchronized AuditEntry append(UUID taskId, String stepId, String actor, String action,
                                          double riskScore, AuditDecision decision) {
        Optional<AuditEntry> last = repository.findLast(taskId);
        long sequence = last.map(e -> e.sequence() + 1).orElse(0L);
        String previousHash = last.map(AuditEntry::hash).orElse(AuditEntry.GENESIS_HASH);
        // stored timestamps only keep milliseconds
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        AuditEntry unsealed = new AuditEntry(UUID.randomUUID(), taskId, sequence, stepId, actor, action,
            riskScore, decision, timestamp, previousHash, null);
        AuditEntry entry = new AuditEntry(unsealed.entryId(), taskId, sequence, stepId, actor, action,
            riskScore, decision, timestamp, previousHash, hash(unsealed));
        repository.append(entry);
        log.debug("Audit #{} for task {}: {} {} ({})", sequence, taskId, actor, action, decision);
        return entry;
    }

    public List<AuditEntry> entries(UUID taskId) {
        return repository.findByTask(taskId);
    }

    /**
     * Recompute the chain and report the first mismatching entry.
     */
    public AuditVerification verify(UUID taskId) {
        List<AuditEntry> entries = repository.findByTask(taskId);
        String expectedPrevious = AuditEntry.GENESIS_HASH;
        for (int i = 0; i < entries.size(); i++) {
            AuditEntry entry = entries.get(i);
            if (entry.sequence() != i
                    || !expectedPrevious.equals(entry.previousHash())
                    || !hash(entry).equals(entry.hash())) {
                log.warn("Audit chain of task {} broken at entry {}", taskId, i);
                return AuditVerification.broken(taskId, entries.size(), i);
            }
            expectedPrevious = entry.hash();
        }
        return AuditVerification.intact(taskId, entries.size());
    }

    /**
     * @throws AuditChainBrokenException if the chain does not verify
     */
    public void requireIntact(UUID taskId) {
        AuditVerification verification = verify(taskId);
        if (!verification.intact()) {
            throw new AuditChainBrokenException(taskId, verification.brokenAtSequence());
        }
    }

    static String hash(AuditEntry entry) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(entry.canonicalContent().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
