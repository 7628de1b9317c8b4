package com.intentflow.core.bus.payload;

import com.intentflow.core.model.AuditDecision;

import java.time.Instant;
import java.util.UUID;

/**
 * SECURITY_DECISION payload. The confirmation token is only present when the plan
 * waits for a human and is addressed to whoever presents the prompt.
 */
public record SecurityDecisionNotice(
    UUID taskId,
    UUID planId,
    AuditDecision decision,
    double aggregateRisk,
    String confirmationToken,
    Instant confirmationExpiresAt
) {
}
