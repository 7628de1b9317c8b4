package com.intentflow.core.health;

import java.time.Instant;

/**
 * Liveness report of a single agent.
 */
public record AgentHealth(
    String agentId,
    HealthStatus status,
    Instant lastProcessedAt,
    String detail
) {
}
