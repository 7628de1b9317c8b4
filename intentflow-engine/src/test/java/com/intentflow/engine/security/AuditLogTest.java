package com.intentflow.engine.security;

import com.intentflow.core.exception.AuditChainBrokenException;
import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.AuditEntry;
import com.intentflow.core.test.TimeController;
import com.intentflow.engine.persistence.InMemoryAuditRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditLogTest {

    private final TimeController time = TimeController.frozen();
    private final UUID taskId = UUID.randomUUID();

    @Test
    @DisplayName("Entries link to their predecessor and verify as intact")
    void shouldChainEntries() {
        AuditLog log = new AuditLog(new InMemoryAuditRepository(), time);

        AuditEntry first = log.append(taskId, null, "security-gate", "evaluate plan v1", 0.2,
            AuditDecision.AUTO_APPROVED);
        time.advanceSeconds(1);
        AuditEntry second = log.append(taskId, "s1", "execution", "dispatch read_content attempt 1", 0.2,
            AuditDecision.AUTO_APPROVED);

        assertThat(first.sequence()).isZero();
        assertThat(first.previousHash()).isEqualTo(AuditEntry.GENESIS_HASH);
        assertThat(second.sequence()).isEqualTo(1);
        assertThat(second.previousHash()).isEqualTo(first.hash());
        assertThat(first.hash()).hasSize(64).isNotEqualTo(second.hash());

        AuditVerification verification = log.verify(taskId);
        assertThat(verification.intact()).isTrue();
        assertThat(verification.entryCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Chains of different tasks are independent")
    void shouldKeepChainsPerTask() {
        AuditLog log = new AuditLog(new InMemoryAuditRepository(), time);
        UUID otherTask = UUID.randomUUID();

        log.append(taskId, null, "security-gate", "evaluate", 0.1, AuditDecision.AUTO_APPROVED);
        AuditEntry other = log.append(otherTask, null, "security-gate", "evaluate", 0.1, AuditDecision.AUTO_APPROVED);

        assertThat(other.sequence()).isZero();
        assertThat(other.previousHash()).isEqualTo(AuditEntry.GENESIS_HASH);
    }

    @Test
    @DisplayName("Changing a stored entry is detected at that entry")
    void shouldDetectTampering() {
        TamperingAuditRepository repository = new TamperingAuditRepository();
        AuditLog log = new AuditLog(repository, time);
        log.append(taskId, null, "security-gate", "evaluate plan v1", 0.6, AuditDecision.CONFIRMATION_REQUESTED);
        log.append(taskId, null, "api", "confirm plan v1", 0.6, AuditDecision.CONFIRMED);
        log.append(taskId, "s1", "execution", "dispatch open_file attempt 1", 0.3, AuditDecision.CONFIRMED);

        repository.rewriteAction(1, "confirm plan v2");

        AuditVerification verification = log.verify(taskId);
        assertThat(verification.intact()).isFalse();
        assertThat(verification.brokenAtSequence()).isEqualTo(1);
        assertThatThrownBy(() -> log.requireIntact(taskId))
            .isInstanceOf(AuditChainBrokenException.class)
            .hasMessageContaining("broken at entry 1");
    }

    @Test
    @DisplayName("Removing an entry breaks the chain")
    void shouldDetectRemoval() {
        TamperingAuditRepository repository = new TamperingAuditRepository();
        AuditLog log = new AuditLog(repository, time);
        log.append(taskId, null, "security-gate", "evaluate", 0.1, AuditDecision.AUTO_APPROVED);
        log.append(taskId, "s1", "execution", "dispatch", 0.1, AuditDecision.AUTO_APPROVED);
        log.append(taskId, "s2", "execution", "dispatch", 0.1, AuditDecision.AUTO_APPROVED);
        assertThatCode(() -> log.requireIntact(taskId)).doesNotThrowAnyException();

        repository.drop(1);

        assertThat(log.verify(taskId).intact()).isFalse();
    }

    /**
     * Audit store whose reads can be altered after the fact.
     */
    private static class TamperingAuditRepository extends InMemoryAuditRepository {

        private int rewriteIndex = -1;
        private String rewrittenAction;
        private int droppedIndex = -1;

        void rewriteAction(int index, String action) {
            this.rewriteIndex = index;
            this.rewrittenAction = action;
        }

        void drop(int index) {
            this.droppedIndex = index;
        }

        @Override
        public synchronized List<AuditEntry> findByTask(UUID taskId) {
            List<AuditEntry> entries = new ArrayList<>(super.findByTask(taskId));
            if (rewriteIndex >= 0 && rewriteIndex < entries.size()) {
                AuditEntry e = entries.get(rewriteIndex);
                entries.set(rewriteIndex, new AuditEntry(e.entryId(), e.taskId(), e.sequence(), e.stepId(),
                    e.actor(), rewrittenAction, e.riskScore(), e.decision(), e.timestamp(), e.previousHash(),
                    e.hash()));
            }
            if (droppedIndex >= 0 && droppedIndex < entries.size()) {
                entries.remove(droppedIndex);
            }
            return entries;
        }
    }
}
