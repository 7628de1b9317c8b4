package com.intentflow.core.health;

/**
 * Implemented by every agent that reports its liveness.
 */
public interface HealthReporter {

    AgentHealth health();
}
