package com.intentflow.core.model;

/**
 * Data classification of a step's target.
 */
public enum DataSensitivity {
    PUBLIC,
    INTERNAL,
    CONFIDENTIAL,
    RESTRICTED
}
