package com.intentflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.exception.DuplicateTaskException;
import com.intentflow.core.exception.NotFoundException;
import com.intentflow.core.exception.OptimisticLockException;
import com.intentflow.core.model.Task;
import com.intentflow.core.model.TaskFailure;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.core.repository.TaskRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of TaskRepository.
 * Concurrent writers are detected through the version column.
 */
@Repository("jdbcTaskRepository")
@ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "jdbc")
public class JdbcTaskRepository implements TaskRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final TaskRowMapper rowMapper = new TaskRowMapper();

    @Autowired
    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, MessageCodec codec) {
        this(jdbcTemplate, codec.objectMapper());
    }

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public Task save(Task task) {
        String sql = """
            INSERT INTO tasks (
                task_id, intent, role_scope, priority, status, correlation_id,
                current_plan_id, plan_version, cancel_requested, failure_json,
                fence_token, version, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, 0, ?, ?)
            ON CONFLICT (task_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            task.taskId(),
            task.intent(),
            task.roleScope(),
            task.priority(),
            task.status().name(),
            task.correlationId(),
            task.currentPlanId(),
            task.planVersion(),
            task.cancelRequested(),
            toJson(task.failure()),
            task.fenceToken(),
            Timestamp.from(task.createdAt()),
            Timestamp.from(task.updatedAt())
        );

        if (rows == 0) {
            throw new DuplicateTaskException(task.taskId());
        }
        return task.withVersion(0);
    }

    @Override
    @Transactional
    public Task update(Task task) {
        String sql = """
            UPDATE tasks SET
                status = ?,
                current_plan_id = ?,
                plan_version = ?,
                cancel_requested = ?,
                failure_json = ?::jsonb,
                fence_token = ?,
                version = version + 1,
                updated_at = ?
            WHERE task_id = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            task.status().name(),
            task.currentPlanId(),
            task.planVersion(),
            task.cancelRequested(),
            toJson(task.failure()),
            task.fenceToken(),
            Timestamp.from(task.updatedAt()),
            task.taskId(),
            task.version()
        );

        if (rows == 0) {
            if (findById(task.taskId()).isEmpty()) {
                throw new NotFoundException("Task", task.taskId().toString());
            }
            throw new OptimisticLockException("Task", task.taskId().toString(), task.version());
        }
        return task.withVersion(task.version() + 1);
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        String sql = "SELECT * FROM tasks WHERE task_id = ?";
        return jdbcTemplate.query(sql, rowMapper, taskId).stream().findFirst();
    }

    @Override
    public List<Task> findByStatus(TaskStatus status, int limit) {
        String sql = "SELECT * FROM tasks WHERE status = ? ORDER BY updated_at LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    @Override
    public List<Task> findNonTerminal(int limit) {
        String sql = """
            SELECT * FROM tasks
            WHERE status NOT IN ('COMPLETED', 'FAILED', 'CANCELLED')
            ORDER BY created_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, limit);
    }

    // ========== Helper Methods ==========

    private String toJson(Object obj) {
        if (obj == null) return null;
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task failure", e);
        }
    }

    private class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            String planId = rs.getString("current_plan_id");
            String failureJson = rs.getString("failure_json");
            try {
                return new Task(
                    UUID.fromString(rs.getString("task_id")),
                    rs.getString("intent"),
                    rs.getString("role_scope"),
                    rs.getInt("priority"),
                    TaskStatus.valueOf(rs.getString("status")),
                    rs.getString("correlation_id"),
                    planId != null ? UUID.fromString(planId) : null,
                    rs.getInt("plan_version"),
                    rs.getBoolean("cancel_requested"),
                    failureJson != null ? objectMapper.readValue(failureJson, TaskFailure.class) : null,
                    rs.getLong("fence_token"),
                    rs.getLong("version"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant()
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map task row", e);
            }
        }
    }
}
