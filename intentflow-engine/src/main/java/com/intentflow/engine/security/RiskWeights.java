package com.intentflow.engine.security;

import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.DataSensitivity;

import java.util.EnumMap;
import java.util.Map;

/**
 * Inputs of the step risk function.
 *
 * @param categoryWeights    Base weight in [0, 1] per action category
 * @param sensitivityWeights Base weight in [0, 1] per data sensitivity class
 * @param categoryFactor     Share of the category weight in the score
 * @param sensitivityFactor  Share of the sensitivity weight in the score
 * @param historyFactor      Share of the learned historical signal in the score
 */
public record RiskWeights(
    Map<ActionCategory, Double> categoryWeights,
    Map<DataSensitivity, Double> sensitivityWeights,
    double categoryFactor,
    double sensitivityFactor,
    double historyFactor
) {
    public RiskWeights {
        categoryWeights = Map.copyOf(categoryWeights);
        sensitivityWeights = Map.copyOf(sensitivityWeights);
        for (ActionCategory category : ActionCategory.values()) {
            if (!categoryWeights.containsKey(category)) {
                throw new IllegalArgumentException("Missing risk weight for category " + category);
            }
        }
        for (DataSensitivity sensitivity : DataSensitivity.values()) {
            if (!sensitivityWeights.containsKey(sensitivity)) {
                throw new IllegalArgumentException("Missing risk weight for sensitivity " + sensitivity);
            }
        }
    }

    public static RiskWeights defaults() {
        Map<ActionCategory, Double> categories = new EnumMap<>(ActionCategory.class);
        categories.put(ActionCategory.READ, 0.1);
        categories.put(ActionCategory.OPEN, 0.1);
        categories.put(ActionCategory.COMPUTE, 0.1);
        categories.put(ActionCategory.COMMUNICATE, 0.5);
        categories.put(ActionCategory.WRITE_SYSTEM_STATE, 0.7);
        categories.put(ActionCategory.DELETE, 0.8);
        categories.put(ActionCategory.FINANCIAL_TRANSACTION, 1.0);

        Map<DataSensitivity, Double> sensitivities = new EnumMap<>(DataSensitivity.class);
        sensitivities.put(DataSensitivity.PUBLIC, 0.1);
        sensitivities.put(DataSensitivity.INTERNAL, 0.4);
        sensitivities.put(DataSensitivity.CONFIDENTIAL, 0.7);
        sensitivities.put(DataSensitivity.RESTRICTED, 1.0);

        return new RiskWeights(categories, sensitivities, 0.6, 0.3, 0.1);
    }

    public double categoryWeight(ActionCategory category) {
        return categoryWeights.get(category);
    }

    public double sensitivityWeight(DataSensitivity sensitivity) {
        return sensitivityWeights.get(sensitivity);
    }
}
