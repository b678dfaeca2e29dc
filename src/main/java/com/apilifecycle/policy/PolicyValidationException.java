package com.apilifecycle.policy;

/**
 * Thrown when a deprecation policy violates one of its temporal invariants
 * (sunset before deprecation, empty or inverted brownout window, ...).
 */
public class PolicyValidationException extends IllegalArgumentException {

    public PolicyValidationException(String message) {
        super(message);
    }
}
