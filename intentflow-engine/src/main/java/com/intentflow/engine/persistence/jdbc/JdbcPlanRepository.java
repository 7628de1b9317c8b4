package com.intentflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.exception.NotFoundException;
import com.intentflow.core.model.Plan;
import com.intentflow.core.model.PlanStatus;
import com.intentflow.core.model.Step;
import com.intentflow.core.repository.PlanRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of PlanRepository. Steps are kept as a JSON document
 * on the plan row since they never change once the plan is written.
 */
@Repository("jdbcPlanRepository")
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "jdbc")
public class JdbcPlanRepository implements PlanRepository {

    private static final TypeReference<List<Step>> STEP_LIST = new TypeReference<>() { };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final PlanRowMapper rowMapper = new PlanRowMapper();

    @Autowired
    public JdbcPlanRepository(JdbcTemplate jdbcTemplate, MessageCodec codec) {
        this(jdbcTemplate, codec.objectMapper());
    }

    public JdbcPlanRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public Plan save(Plan plan) {
        String sql = """
            INSERT INTO plans (
                plan_id, task_id, version, steps_json, estimated_duration_ms,
                aggregate_risk_score, status, context_degraded, supersedes_plan_id, created_at
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (plan_id) DO UPDATE SET
                steps_json = EXCLUDED.steps_json,
                aggregate_risk_score = EXCLUDED.aggregate_risk_score,
                status = EXCLUDED.status
            """;

        jdbcTemplate.update(sql,
            plan.planId(),
            plan.taskId(),
            plan.version(),
            toJson(plan.steps()),
            plan.estimatedDuration() != null ? plan.estimatedDuration().toMillis() : null,
            plan.aggregateRiskScore(),
            plan.status().name(),
            plan.contextDegraded(),
            plan.supersedesPlanId(),
            Timestamp.from(plan.createdAt())
        );
        return plan;
    }

    @Override
    @Transactional
    public void updateStatus(UUID planId, PlanStatus status) {
        int rows = jdbcTemplate.update("UPDATE plans SET status = ? WHERE plan_id = ?", status.name(), planId);
        if (rows == 0) {
            throw new NotFoundException("Plan", planId.toString());
        }
    }

    @Override
    @Transactional
    public void updateRiskScores(Plan scoredPlan) {
        String sql = """
            UPDATE plans SET
                steps_json = ?::jsonb,
                aggregate_risk_score = ?
            WHERE plan_id = ?
            """;
        int rows = jdbcTemplate.update(sql,
            toJson(scoredPlan.steps()),
            scoredPlan.aggregateRiskScore(),
            scoredPlan.planId()
        );
        if (rows == 0) {
            throw new NotFoundException("Plan", scoredPlan.planId().toString());
        }
    }

    @Override
    public Optional<Plan> findById(UUID planId) {
        String sql = "SELECT * FROM plans WHERE plan_id = ?";
        return jdbcTemplate.query(sql, rowMapper, planId).stream().findFirst();
    }

    @Override
    public List<Plan> findByTask(UUID taskId) {
        String sql = "SELECT * FROM plans WHERE task_id = ? ORDER BY version";
        return jdbcTemplate.query(sql, rowMapper, taskId);
    }

    // ========== Helper Methods ==========

    private String toJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize plan steps", e);
        }
    }

    private class PlanRowMapper implements RowMapper<Plan> {
        @Override
        public Plan mapRow(ResultSet rs, int rowNum) throws SQLException {
            String supersedes = rs.getString("supersedes_plan_id");
            long durationMs = rs.getLong("estimated_duration_ms");
            Duration estimated = rs.wasNull() ? null : Duration.ofMillis(durationMs);
            try {
                return new Plan(
                    UUID.fromString(rs.getString("plan_id")),
                    UUID.fromString(rs.getString("task_id")),
                    rs.getInt("version"),
                    objectMapper.readValue(rs.getString("steps_json"), STEP_LIST),
                    estimated,
                    rs.getDouble("aggregate_risk_score"),
                    PlanStatus.valueOf(rs.getString("status")),
                    rs.getBoolean("context_degraded"),
                    supersedes != null ? UUID.fromString(supersedes) : null,
                    rs.getTimestamp("created_at").toInstant()
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map plan row", e);
            }
        }
    }
}
