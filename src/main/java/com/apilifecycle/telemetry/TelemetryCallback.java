package com.apilifecycle.telemetry;

/**
 * Sink notified whenever a request hits a deprecated, sunset or browned-out operation.
 * Implementations may throw; the dispatcher contains the failure.
 */
@FunctionalInterface
public interface TelemetryCallback {

    void onDeprecatedUsage(TelemetryContext context) throws Exception;
}
