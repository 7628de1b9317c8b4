package com.intentflow.api.rest;

import com.intentflow.core.health.AgentHealth;
import com.intentflow.core.health.HealthStatus;
import com.intentflow.engine.health.AgentHealthIndicator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-agent liveness plus an aggregate: down if any agent is down, degraded if any is degraded.
 */
@RestController
public class HealthController {

    private final AgentHealthIndicator agentHealth;

    public HealthController(AgentHealthIndicator agentHealth) {
        this.agentHealth = agentHealth;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        List<AgentHealth> agents = agentHealth.agents();
        HealthStatus overall = HealthStatus.OK;
        Map<String, AgentStatus> byAgent = new LinkedHashMap<>();
        for (AgentHealth agent : agents) {
            overall = overall.worst(agent.status());
            byAgent.put(agent.agentId(), new AgentStatus(agent.status(), agent.lastProcessedAt(), agent.detail()));
        }
        HttpStatus httpStatus = overall == HealthStatus.DOWN ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(overall, byAgent));
    }

    public record HealthResponse(HealthStatus status, Map<String, AgentStatus> agents) {}

    public record AgentStatus(HealthStatus status, Instant lastProcessedAt, String detail) {}
}
