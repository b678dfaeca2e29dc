package com.apilifecycle.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of evaluating a deprecation policy at an instant.
 */
public enum LifecycleAction {
    ALLOW("allow"),
    WARN("warn"),
    BLOCK_SUNSET("block_sunset"),
    BLOCK_BROWNOUT("block_brownout");

    private final String value;

    LifecycleAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isBlocking() {
        return this == BLOCK_SUNSET || this == BLOCK_BROWNOUT;
    }
}
