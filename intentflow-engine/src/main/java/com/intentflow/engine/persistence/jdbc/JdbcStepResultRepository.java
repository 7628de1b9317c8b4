package com.intentflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.model.StepKind;
import com.intentflow.core.model.StepOutcome;
import com.intentflow.core.model.StepResult;
import com.intentflow.core.repository.StepResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of StepResultRepository.
 * The deduplication key is the primary key, so a redelivered result is a no-op insert.
 */
@Repository("jdbcStepResultRepository")
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "jdbc")
public class JdbcStepResultRepository implements StepResultRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcStepResultRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final StepResultRowMapper rowMapper = new StepResultRowMapper();

    @Autowired
    public JdbcStepResultRepository(JdbcTemplate jdbcTemplate, MessageCodec codec) {
        this(jdbcTemplate, codec.objectMapper());
    }

    public JdbcStepResultRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean append(StepResult result) {
        String sql = """
            INSERT INTO step_results (
                dedup_key, task_id, plan_id, step_id, attempt, kind, outcome,
                output_json, error_code, error_message, retryable, duration_ms, recorded_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
            ON CONFLICT (dedup_key) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            result.dedupKey(),
            result.taskId(),
            result.planId(),
            result.stepId(),
            result.attempt(),
            result.kind().name(),
            result.outcome().name(),
            result.output() != null ? result.output().toString() : null,
            result.errorCode(),
            result.errorMessage(),
            result.retryable(),
            result.durationMs(),
            Timestamp.from(result.timestamp())
        );

        if (rows == 0) {
            log.debug("Step result {} already recorded", result.dedupKey());
        }
        return rows > 0;
    }

    @Override
    public List<StepResult> findByTask(UUID taskId) {
        String sql = "SELECT * FROM step_results WHERE task_id = ? ORDER BY seq";
        return jdbcTemplate.query(sql, rowMapper, taskId);
    }

    @Override
    public boolean exists(String dedupKey) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM step_results WHERE dedup_key = ?", Integer.class, dedupKey);
        return count != null && count > 0;
    }

    private class StepResultRowMapper implements RowMapper<StepResult> {
        @Override
        public StepResult mapRow(ResultSet rs, int rowNum) throws SQLException {
            String planId = rs.getString("plan_id");
            String output = rs.getString("output_json");
            try {
                return new StepResult(
                    UUID.fromString(rs.getString("task_id")),
                    planId != null ? UUID.fromString(planId) : null,
                    rs.getString("step_id"),
                    rs.getInt("attempt"),
                    StepKind.valueOf(rs.getString("kind")),
                    StepOutcome.valueOf(rs.getString("outcome")),
                    output != null ? objectMapper.readTree(output) : null,
                    rs.getString("error_code"),
                    rs.getString("error_message"),
                    rs.getBoolean("retryable"),
                    rs.getLong("duration_ms"),
                    rs.getTimestamp("recorded_at").toInstant()
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map step result row", e);
            }
        }
    }
}
