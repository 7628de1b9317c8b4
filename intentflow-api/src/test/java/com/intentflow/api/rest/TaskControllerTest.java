package com.intentflow.api.rest;

import com.intentflow.core.exception.ConfirmationTimeoutException;
import com.intentflow.core.exception.InvalidConfirmationException;
import com.intentflow.core.exception.MissingCompensationException;
import com.intentflow.core.exception.NotFoundException;
import com.intentflow.core.exception.PlanCycleException;
import com.intentflow.core.model.TaskRequest;
import com.intentflow.core.model.TaskStatus;
import com.intentflow.engine.lifecycle.GracefulShutdownHandler;
import com.intentflow.engine.service.TaskService;
import com.intentflow.engine.service.TaskService.TaskSubmission;
import com.intentflow.engine.service.TaskService.TaskView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TaskControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private TaskService taskService;
    private GracefulShutdownHandler shutdownHandler;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        taskService = mock(TaskService.class);
        shutdownHandler = mock(GracefulShutdownHandler.class);
        when(shutdownHandler.canAcceptTasks()).thenReturn(true);
        mockMvc = MockMvcBuilders.standaloneSetup(new TaskController(taskService, shutdownHandler))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private static TaskView view(UUID taskId, TaskStatus status) {
        return new TaskView(taskId, "archive last quarter's invoices", "finance", 3, status, false, null, null, null,
            null, NOW, NOW);
    }

    @Test
    @DisplayName("Submitting an intent returns 202 with the confirmation token of a gated plan")
    void shouldAcceptSubmission() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.submitTask(any())).thenReturn(new TaskSubmission(taskId, TaskStatus.AWAITING_CONFIRMATION,
            0.85, "signed-token", NOW.plusSeconds(300), null));

        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"taskId":"%s","intent":"delete the staging bucket","roleScope":"ops","priority":2}
                    """.formatted(taskId)))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.taskId").value(taskId.toString()))
            .andExpect(jsonPath("$.status").value("AWAITING_CONFIRMATION"))
            .andExpect(jsonPath("$.confirmationToken").value("signed-token"));

        ArgumentCaptor<TaskRequest> request = ArgumentCaptor.forClass(TaskRequest.class);
        verify(taskService).submitTask(request.capture());
        assertThat(request.getValue().taskId()).isEqualTo(taskId);
        assertThat(request.getValue().roleScope()).isEqualTo("ops");
        assertThat(request.getValue().priority()).isEqualTo(2);
    }

    @Test
    @DisplayName("A blank intent is a bad request")
    void shouldRejectBlankIntent() throws Exception {
        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"intent\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        verify(taskService, never()).submitTask(any());
    }

    @Test
    @DisplayName("Submissions are refused while the process shuts down")
    void shouldRefuseSubmissionDuringShutdown() throws Exception {
        when(shutdownHandler.canAcceptTasks()).thenReturn(false);

        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"intent\":\"send the weekly report\"}"))
            .andExpect(status().isServiceUnavailable());

        verify(taskService, never()).submitTask(any());
    }

    @Test
    @DisplayName("A plan with a dependency cycle is unprocessable")
    void shouldMapPlanCycleTo422() throws Exception {
        when(taskService.submitTask(any())).thenThrow(new PlanCycleException(List.of("s1", "s2")));

        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"intent\":\"sync the calendars\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value(PlanCycleException.ERROR_CODE));
    }

    @Test
    @DisplayName("A risky step without compensation is unprocessable")
    void shouldMapMissingCompensationTo422() throws Exception {
        when(taskService.submitTask(any())).thenThrow(new MissingCompensationException("s2", "wire_transfer"));

        mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"intent\":\"wire the refund\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value(MissingCompensationException.ERROR_CODE));
    }

    @Test
    @DisplayName("An unknown task is 404 and the body names the task")
    void shouldMapNotFoundTo404() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.getTask(taskId)).thenThrow(new NotFoundException("Task", taskId.toString()));

        mockMvc.perform(get("/tasks/{taskId}", taskId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.taskId").value(taskId.toString()))
            .andExpect(jsonPath("$.errorCode").value(NotFoundException.ERROR_CODE));
    }

    @Test
    @DisplayName("Listing passes the optional status filter through")
    void shouldListTasks() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.findTasks(TaskStatus.RUNNING, 20)).thenReturn(List.of(view(taskId, TaskStatus.RUNNING)));

        mockMvc.perform(get("/tasks").param("status", "RUNNING").param("limit", "20"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].taskId").value(taskId.toString()))
            .andExpect(jsonPath("$[0].status").value("RUNNING"));
    }

    @Test
    @DisplayName("An unknown status filter is a bad request")
    void shouldRejectUnknownStatus() throws Exception {
        mockMvc.perform(get("/tasks").param("status", "SLEEPING"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Confirming with a valid token returns the running task")
    void shouldConfirm() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.confirm(taskId, "signed-token", "alice")).thenReturn(view(taskId, TaskStatus.RUNNING));

        mockMvc.perform(post("/tasks/{taskId}/confirm", taskId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"confirmationToken\":\"signed-token\",\"actor\":\"alice\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    @DisplayName("A missing token is rejected before reaching the orchestrator")
    void shouldRequireToken() throws Exception {
        mockMvc.perform(post("/tasks/{taskId}/confirm", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());

        verify(taskService, never()).confirm(any(), anyString(), anyString());
    }

    @Test
    @DisplayName("A mismatched token conflicts with the pending confirmation")
    void shouldMapInvalidConfirmationTo409() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.confirm(eq(taskId), anyString(), anyString()))
            .thenThrow(new InvalidConfirmationException(taskId, "token does not match the pending plan"));

        mockMvc.perform(post("/tasks/{taskId}/confirm", taskId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"confirmationToken\":\"forged\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.taskId").value(taskId.toString()))
            .andExpect(jsonPath("$.errorCode").value(InvalidConfirmationException.ERROR_CODE));

        verify(taskService).confirm(taskId, "forged", "api");
    }

    @Test
    @DisplayName("An expired token is a conflict")
    void shouldMapConfirmationTimeoutTo409() {
        assertThat(GlobalExceptionHandler.statusOf(ConfirmationTimeoutException.ERROR_CODE).value()).isEqualTo(409);
    }

    @Test
    @DisplayName("Cancellation is accepted and happens asynchronously")
    void shouldRequestCancel() throws Exception {
        UUID taskId = UUID.randomUUID();

        mockMvc.perform(post("/tasks/{taskId}/cancel", taskId))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.cancelRequested").value(true));

        verify(taskService).requestCancel(taskId, "cancelled via api");
    }

    @Test
    @DisplayName("Cancelling an unknown task is 404")
    void shouldNotCancelUnknownTask() throws Exception {
        UUID taskId = UUID.randomUUID();
        doThrow(new NotFoundException("Task", taskId.toString())).when(taskService).requestCancel(eq(taskId), any());

        mockMvc.perform(post("/tasks/{taskId}/cancel", taskId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\":\"wrong recipient\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Feedback outside the rating scale is a bad request")
    void shouldRejectOutOfRangeRating() throws Exception {
        UUID taskId = UUID.randomUUID();
        doThrow(new IllegalArgumentException("humanRating must be between 1 and 5"))
            .when(taskService).submitFeedback(eq(taskId), anyInt(), any());

        mockMvc.perform(post("/tasks/{taskId}/feedback", taskId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"humanRating\":9}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Feedback is recorded")
    void shouldRecordFeedback() throws Exception {
        UUID taskId = UUID.randomUUID();

        mockMvc.perform(post("/tasks/{taskId}/feedback", taskId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"humanRating\":4,\"correctionNotes\":\"should have cc'd finance\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.recorded").value(true));

        verify(taskService).submitFeedback(taskId, 4, "should have cc'd finance");
    }
}
