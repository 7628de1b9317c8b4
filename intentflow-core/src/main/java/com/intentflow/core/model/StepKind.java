package com.intentflow.core.model;

/**
 * Whether a dispatch runs a step's action or its compensating action.
 */
public enum StepKind {
    FORWARD,
    COMPENSATION
}
