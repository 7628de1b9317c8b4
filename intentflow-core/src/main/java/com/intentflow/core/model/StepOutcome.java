package com.intentflow.core.model;

public enum StepOutcome {
    SUCCESS,
    FAILED,
    TIMEOUT
}
