package com.intentflow.engine.security;

import com.intentflow.core.model.ActionDescriptor;
import com.intentflow.core.spi.RiskSignalProvider;

/**
 * Computes the risk score of a single action.
 *
 * score = categoryFactor * w(category) + sensitivityFactor * w(sensitivity)
 *       + historyFactor * signal(category, sensitivity), clamped to [0, 1]
 */
public class RiskScorer {

    private final RiskWeights weights;
    private final RiskSignalProvider signals;

    public RiskScorer(RiskWeights weights, RiskSignalProvider signals) {
        this.weights = weights;
        this.signals = signals;
    }

    public double score(ActionDescriptor action) {
        double signal = clamp(signals.historicalSignal(action.category(), action.sensitivity()));
        double raw = weights.categoryFactor() * weights.categoryWeight(action.category())
            + weights.sensitivityFactor() * weights.sensitivityWeight(action.sensitivity())
            + weights.historyFactor() * signal;
        return clamp(raw);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
