package com.apilifecycle.telemetry;

/**
 * Wraps a failure raised by a registered {@link TelemetryCallback}.
 * Created and logged at the dispatch boundary, never propagated to the request path.
 */
public class TelemetryCallbackException extends RuntimeException {

    public TelemetryCallbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
