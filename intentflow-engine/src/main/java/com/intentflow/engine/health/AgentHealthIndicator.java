package com.intentflow.engine.health;

import com.intentflow.core.health.AgentHealth;
import com.intentflow.core.health.HealthReporter;
import com.intentflow.core.health.HealthStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the liveness reports of every agent running in this process.
 * A degraded agent keeps the service up; any agent that is down takes it down.
 */
public class AgentHealthIndicator implements HealthIndicator {

    private final List<HealthReporter> reporters;

    public AgentHealthIndicator(List<HealthReporter> reporters) {
        this.reporters = List.copyOf(reporters);
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.OK;

        for (HealthReporter reporter : reporters) {
            AgentHealth agent = check(reporter);
            overall = overall.worst(agent.status());
            details.put(agent.agentId(), describe(agent));
        }

        Health.Builder builder = overall == HealthStatus.DOWN ? Health.down() : Health.up();
        return builder
            .withDetail("status", overall.wireName())
            .withDetails(details)
            .build();
    }

    /**
     * Current health of every agent in registration order.
     */
    public List<AgentHealth> agents() {
        return reporters.stream().map(AgentHealthIndicator::check).toList();
    }

    private static AgentHealth check(HealthReporter reporter) {
        try {
            return reporter.health();
        } catch (RuntimeException e) {
            return new AgentHealth(reporter.getClass().getSimpleName(), HealthStatus.DOWN, null, e.getMessage());
        }
    }

    private Map<String, Object> describe(AgentHealth agent) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", agent.status().wireName());
        if (agent.lastProcessedAt() != null) {
            detail.put("lastProcessedAt", agent.lastProcessedAt().toString());
        }
        if (agent.detail() != null) {
            detail.put("detail", agent.detail());
        }
        return detail;
    }
}
