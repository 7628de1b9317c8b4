package com.intentflow.api;

import com.intentflow.core.model.ActionCategory;
import com.intentflow.worker.ExecutorRegistry;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "intentflow.security.token-secret=application-test-secret-0123456789abcdef")
@AutoConfigureMockMvc
class IntentFlowApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ExecutorRegistry executorRegistry;

    @Test
    void shouldRunIntentsThroughTheRestApi() throws Exception {
        List<String> executed = new CopyOnWriteArrayList<>();
        for (ActionCategory category : ActionCategory.values()) {
            executorRegistry.register(category, context -> {
                executed.add(context.getAction().name());
                return context.toJsonNode(Map.of("ok", true));
            });
        }

        // low risk: approved at once and executed by the in-process agents
        String submitted = mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"intent\":\"open the report and summarize it\",\"roleScope\":\"analyst\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("RUNNING"))
            .andReturn().getResponse().getContentAsString();
        String taskId = JsonPath.read(submitted, "$.taskId");

        assertThat(awaitStatus(taskId, "COMPLETED")).isEqualTo("COMPLETED");
        assertThat(executed).contains("open_file", "extract_summary");

        mockMvc.perform(get("/tasks/{taskId}/audit", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verification.intact").value(true));

        // medium risk: held for a human, a forged token is refused
        String gated = mockMvc.perform(post("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"intent\":\"Open the quarterly report, summarize it and email the summary to my manager\","
                    + "\"roleScope\":\"analyst\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("AWAITING_CONFIRMATION"))
            .andReturn().getResponse().getContentAsString();
        String gatedId = JsonPath.read(gated, "$.taskId");

        mockMvc.perform(post("/tasks/{taskId}/confirm", gatedId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"confirmationToken\":\"forged\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.taskId").value(gatedId));

        mockMvc.perform(get("/tasks/{taskId}", "6a1c2f7e-0000-4000-8000-000000000000"))
            .andExpect(status().isNotFound());
    }

    private String awaitStatus(String taskId, String expected) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        String current = null;
        while (System.currentTimeMillis() < deadline) {
            String body = mockMvc.perform(get("/tasks/{taskId}", taskId))
                .andReturn().getResponse().getContentAsString();
            current = JsonPath.read(body, "$.status");
            if (expected.equals(current)) {
                return current;
            }
            Thread.sleep(50);
        }
        return current;
    }
}
