package com.intentflow.engine.security;

import com.intentflow.core.model.AuditDecision;
import com.intentflow.core.model.Plan;

/**
 * Outcome of {@link SecurityGate#evaluate}. {@code confirmation} is only set when the
 * plan waits for a human.
 */
public record GateDecision(
    AuditDecision decision,
    double aggregateRisk,
    Plan scoredPlan,
    IssuedToken confirmation
) {
    public boolean isApproved() {
        return decision == AuditDecision.AUTO_APPROVED;
    }

    public boolean requiresConfirmation() {
        return decision == AuditDecision.CONFIRMATION_REQUESTED;
    }

    public boolean isRejected() {
        return decision == AuditDecision.REJECTED;
    }
}
