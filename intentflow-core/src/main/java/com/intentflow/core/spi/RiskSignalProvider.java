package com.intentflow.core.spi;

import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.DataSensitivity;

/**
 * Historical failure/abuse signal in [0, 1] fed into step risk scoring.
 */
@FunctionalInterface
public interface RiskSignalProvider {

    double historicalSignal(ActionCategory category, DataSensitivity sensitivity);

    /**
     * Provider that has learned nothing yet.
     */
    static RiskSignalProvider neutral() {
        return (category, sensitivity) -> 0.0;
    }
}
