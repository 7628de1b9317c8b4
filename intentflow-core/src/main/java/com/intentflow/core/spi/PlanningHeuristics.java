package com.intentflow.core.spi;

import com.intentflow.core.model.ActionCategory;

import java.time.Duration;
import java.util.Optional;

/**
 * Learned hints planning uses in place of static defaults.
 */
@FunctionalInterface
public interface PlanningHeuristics {

    Optional<Duration> expectedDuration(ActionCategory category);

    static PlanningHeuristics none() {
        return category -> Optional.empty();
    }
}
