package com.intentflow.core.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    OK("ok"),
    DEGRADED("degraded"),
    DOWN("down");

    private final String wireName;

    HealthStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * The worse of two statuses.
     */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
