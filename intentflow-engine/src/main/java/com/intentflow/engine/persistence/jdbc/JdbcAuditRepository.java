package com.intentflow.engine.persistence.jdbc;

import com.intentflow.core.exception.OptimisticLockException;
import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.AuditEntry;
import com.intentflow.core.repository.AuditRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of AuditRepository. Rows are only ever inserted;
 * the unique (task_id, sequence) pair rejects a second writer racing on the same link.
 */
@Repository("jdbcAuditRepository")
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "jdbc")
public class JdbcAuditRepository implements AuditRepository {

    private static final RowMapper<AuditEntry> ROW_MAPPER = new AuditEntryRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcAuditRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void append(AuditEntry entry) {
        String sql = """
            INSERT INTO audit_entries (
                entry_id, task_id, sequence, step_id, actor, action,
                risk_score, decision, recorded_at, previous_hash, hash
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                entry.entryId(),
                entry.taskId(),
                entry.sequence(),
                entry.stepId(),
                entry.actor(),
                entry.action(),
                entry.riskScore(),
                entry.decision().name(),
                Timestamp.from(entry.timestamp()),
                entry.previousHash(),
                entry.hash()
            );
        } catch (DuplicateKeyException e) {
            throw new OptimisticLockException("AuditChain", entry.taskId().toString(), entry.sequence());
        }
    }

    @Override
    public List<AuditEntry> findByTask(UUID taskId) {
        String sql = "SELECT * FROM audit_entries WHERE task_id = ? ORDER BY sequence";
        return jdbcTemplate.query(sql, ROW_MAPPER, taskId);
    }

    @Override
    public Optional<AuditEntry> findLast(UUID taskId) {
        String sql = "SELECT * FROM audit_entries WHERE task_id = ? ORDER BY sequence DESC LIMIT 1";
        return jdbcTemplate.query(sql, ROW_MAPPER, taskId).stream().findFirst();
    }

    private static class AuditEntryRowMapper implements RowMapper<AuditEntry> {
        @Override
        public AuditEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new AuditEntry(
                UUID.fromString(rs.getString("entry_id")),
                UUID.fromString(rs.getString("task_id")),
                rs.getLong("sequence"),
                rs.getString("step_id"),
                rs.getString("actor"),
                rs.getString("action"),
                rs.getDouble("risk_score"),
                AuditDecision.valueOf(rs.getString("decision")),
                rs.getTimestamp("recorded_at").toInstant(),
                rs.getString("previous_hash"),
                rs.getString("hash")
            );
        }
    }
}
