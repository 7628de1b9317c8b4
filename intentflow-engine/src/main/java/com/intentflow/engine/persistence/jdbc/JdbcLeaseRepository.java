package com.intentflow.engine.persistence.jdbc;

import com.intentflow.core.model.TaskLease;
import com.intentflow.core.repository.LeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of LeaseRepository.
 *
 * The fence token grows on every acquisition and forced release. An orchestrator that
 * lost its lease without noticing is rejected on its next fenced write.
 */
@Repository("jdbcLeaseRepository")
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "jdbc")
public class JdbcLeaseRepository implements LeaseRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLeaseRepository.class);

    private static final RowMapper<TaskLease> ROW_MAPPER = new TaskLeaseRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcLeaseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public Optional<TaskLease> tryAcquire(TaskLease lease) {
        // Take over only a released lease or one that expired before this request
        String sql = """
            INSERT INTO task_leases (
                lease_key, task_id, holder_id, holder_address,
                acquired_at, expires_at, lease_duration_ms,
                renewal_count, fence_token
            ) VALUES (?, ?, ?, ?, ?, ?, ?, 0, 1)
            ON CONFLICT (lease_key) DO UPDATE SET
                holder_id = EXCLUDED.holder_id,
                holder_address = EXCLUDED.holder_address,
                acquired_at = EXCLUDED.acquired_at,
                expires_at = EXCLUDED.expires_at,
                lease_duration_ms = EXCLUDED.lease_duration_ms,
                renewal_count = 0,
                fence_token = task_leases.fence_token + 1
            WHERE task_leases.expires_at <= EXCLUDED.acquired_at OR task_leases.holder_id IS NULL
            RETURNING fence_token
            """;

        List<Long> tokens = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getLong(1),
            lease.leaseKey(),
            lease.taskId(),
            lease.holderId(),
            lease.holderAddress(),
            Timestamp.from(lease.acquiredAt()),
            Timestamp.from(lease.expiresAt()),
            lease.leaseDuration().toMillis()
        );

        if (tokens.isEmpty()) {
            log.debug("Lease {} is held by another orchestrator", lease.leaseKey());
            return Optional.empty();
        }
        log.debug("Acquired lease {} with fence token {}", lease.leaseKey(), tokens.get(0));
        return Optional.of(lease.withFenceToken(tokens.get(0)));
    }

    @Override
    @Transactional
    public boolean renew(String leaseKey, UUID holderId, Instant now, Instant newExpiresAt) {
        String sql = """
            UPDATE task_leases SET
                expires_at = ?,
                renewal_count = renewal_count + 1
            WHERE lease_key = ? AND holder_id = ? AND expires_at > ?
            """;

        int rows = jdbcTemplate.update(sql,
            Timestamp.from(newExpiresAt),
            leaseKey,
            holderId,
            Timestamp.from(now)
        );

        if (rows == 0) {
            log.warn("Failed to renew lease {} for holder {} - lease expired or holder mismatch",
                leaseKey, holderId);
            return false;
        }
        return true;
    }

    @Override
    @Transactional
    public boolean release(String leaseKey, UUID holderId) {
        String sql = """
            UPDATE task_leases SET
                holder_id = NULL,
                holder_address = NULL
            WHERE lease_key = ? AND holder_id = ?
            """;

        int rows = jdbcTemplate.update(sql, leaseKey, holderId);
        if (rows == 0) {
            log.debug("Lease {} not held by {} or already released", leaseKey, holderId);
        }
        return rows > 0;
    }

    @Override
    @Transactional
    public long forceRelease(String leaseKey) {
        String sql = """
            UPDATE task_leases SET
                holder_id = NULL,
                holder_address = NULL,
                fence_token = fence_token + 1
            WHERE lease_key = ?
            RETURNING fence_token
            """;

        List<Long> tokens = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getLong(1), leaseKey);
        if (tokens.isEmpty()) {
            log.debug("No lease found to force release: {}", leaseKey);
            return 0L;
        }
        log.info("Force released lease {} with new fence token {}", leaseKey, tokens.get(0));
        return tokens.get(0);
    }

    @Override
    public Optional<TaskLease> findByKey(String leaseKey) {
        String sql = "SELECT * FROM task_leases WHERE lease_key = ? AND holder_id IS NOT NULL";
        return jdbcTemplate.query(sql, ROW_MAPPER, leaseKey).stream().findFirst();
    }

    @Override
    public List<TaskLease> findByHolder(UUID holderId) {
        String sql = "SELECT * FROM task_leases WHERE holder_id = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, holderId);
    }

    @Override
    public List<TaskLease> findExpired(Instant now, int limit) {
        String sql = """
            SELECT * FROM task_leases
            WHERE expires_at <= ? AND holder_id IS NOT NULL
            ORDER BY expires_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(now), limit);
    }

    @Override
    public boolean validateFenceToken(String leaseKey, long fenceToken) {
        String sql = "SELECT fence_token FROM task_leases WHERE lease_key = ?";
        List<Long> tokens = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getLong(1), leaseKey);
        return !tokens.isEmpty() && tokens.get(0) == fenceToken;
    }

    private static class TaskLeaseRowMapper implements RowMapper<TaskLease> {
        @Override
        public TaskLease mapRow(ResultSet rs, int rowNum) throws SQLException {
            String holderId = rs.getString("holder_id");
            Timestamp acquiredAt = rs.getTimestamp("acquired_at");

            return new TaskLease(
                rs.getString("lease_key"),
                UUID.fromString(rs.getString("task_id")),
                holderId != null ? UUID.fromString(holderId) : null,
                rs.getString("holder_address"),
                acquiredAt != null ? acquiredAt.toInstant() : null,
                rs.getTimestamp("expires_at").toInstant(),
                Duration.ofMillis(rs.getLong("lease_duration_ms")),
                rs.getInt("renewal_count"),
                rs.getLong("fence_token")
            );
        }
    }
}
