package com.intentflow.core.model;

/**
 * Why a task reached a terminal failure (or was cancelled).
 */
public enum FailureReason {
    PLAN_CYCLE,
    MISSING_COMPENSATION,
    PLAN_INVALID,
    RISK_EXCEEDED,
    CONFIRMATION_TIMEOUT,
    STEP_EXECUTION,
    AUDIT_INTEGRITY,
    CANCELLED
}
