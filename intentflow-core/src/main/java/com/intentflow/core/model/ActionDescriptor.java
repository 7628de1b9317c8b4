package com.intentflow.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What an executor is asked to do. The parameters are opaque to the orchestrator
 * and passed through to the external collaborator unchanged.
 */
public record ActionDescriptor(
    ActionCategory category,
    String name,
    String target,
    DataSensitivity sensitivity,
    Map<String, String> parameters
) {
    public ActionDescriptor {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(name, "name");
        sensitivity = sensitivity != null ? sensitivity : DataSensitivity.INTERNAL;
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static ActionDescriptor of(ActionCategory category, String name, String target) {
        return new ActionDescriptor(category, name, target, DataSensitivity.INTERNAL, Map.of());
    }

    public ActionDescriptor withSensitivity(DataSensitivity sensitivity) {
        return new ActionDescriptor(category, name, target, sensitivity, parameters);
    }

    public ActionDescriptor withParameter(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(parameters);
        copy.put(key, value);
        return new ActionDescriptor(category, name, target, sensitivity, copy);
    }
}
