package com.intentflow.core.model;

public enum AuditDecision {
    AUTO_APPROVED,
    CONFIRMATION_REQUESTED,
    CONFIRMED,
    REJECTED
}
