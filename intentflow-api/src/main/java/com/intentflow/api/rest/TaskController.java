package com.intentflow.api.rest;

import com.intentflow.core.model.TaskRequest;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.engine.lifecycle.GracefulShutdownHandler;
import com.intentflow.engine.service.TaskService;
import com.intentflow.engine.service.TaskService.AuditTrail;
import com.intentflow.engine.service.TaskService.TaskSubmission;
import com.intentflow.engine.service.TaskService.TaskView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for tasks.
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskService taskService;
    private final GracefulShutdownHandler shutdownHandler;

    public TaskController(TaskService taskService, GracefulShutdownHandler shutdownHandler) {
        this.taskService = taskService;
        this.shutdownHandler = shutdownHandler;
    }

    /**
     * Submit an intent. Planning and gating happen before the response; execution
     * continues in the background.
     */
    @PostMapping
    public ResponseEntity<TaskSubmission> submit(@RequestBody SubmitTaskRequest request) {
        if (!shutdownHandler.canAcceptTasks()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        TaskSubmission submission = taskService.submitTask(
            new TaskRequest(request.taskId(), request.intent(), request.roleScope(), request.priority()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submission);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskView> get(@PathVariable UUID taskId) {
        return ResponseEntity.ok(taskService.getTask(taskId));
    }

    @GetMapping
    public ResponseEntity<List<TaskView>> list(
            @RequestParam(required = false) TaskStatus status,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(taskService.findTasks(status, limit));
    }

    /**
     * Confirm a plan waiting for a human.
     */
    @PostMapping("/{taskId}/confirm")
    public ResponseEntity<TaskView> confirm(
            @PathVariable UUID taskId,
            @RequestBody ConfirmRequest request) {
        if (request.confirmationToken() == null || request.confirmationToken().isBlank()) {
            throw new IllegalArgumentException("confirmationToken is required");
        }
        String actor = request.actor() != null ? request.actor() : "api";
        return ResponseEntity.ok(taskService.confirm(taskId, request.confirmationToken(), actor));
    }

    /**
     * Request cancellation. The task stops and compensates asynchronously.
     */
    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(
            @PathVariable UUID taskId,
            @RequestBody(required = false) CancelTaskRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "cancelled via api";
        taskService.requestCancel(taskId, reason);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("taskId", taskId, "cancelRequested", true));
    }

    @PostMapping("/{taskId}/feedback")
    public ResponseEntity<Map<String, Object>> feedback(
            @PathVariable UUID taskId,
            @RequestBody FeedbackRequest request) {
        taskService.submitFeedback(taskId, request.humanRating(), request.correctionNotes());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("taskId", taskId, "recorded", true));
    }

    @GetMapping("/{taskId}/audit")
    public ResponseEntity<AuditTrail> audit(@PathVariable UUID taskId) {
        return ResponseEntity.ok(taskService.auditTrail(taskId));
    }

    // ========== DTOs ==========

    public record SubmitTaskRequest(UUID taskId, String intent, String roleScope, int priority) {}

    public record ConfirmRequest(String confirmationToken, String actor) {}

    public record CancelTaskRequest(String reason) {}

    public record FeedbackRequest(int humanRating, String correctionNotes) {}
}
