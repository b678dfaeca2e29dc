package com.apilifecycle.telemetry;

import com.apilifecycle.engine.LifecycleAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: one log line per deprecated-usage event.
 * Warn-phase hits log at INFO, blocked requests at WARN.
 */
public class LoggingTelemetryCallback implements TelemetryCallback {

    private static final Logger log = LoggerFactory.getLogger("com.apilifecycle.telemetry.usage");

    @Override
    public void onDeprecatedUsage(TelemetryContext context) {
        RequestDescriptor request = context.request();
        LifecycleAction action = context.decision().action();
        String sunset = context.policy().sunset().map(Object::toString).orElse("none");

        if (action.isBlocking()) {
            log.warn("Blocked deprecated operation: method={}, path={}, action={}, status={}, sunset={}",
                request.method(), request.path(), action.getValue(), request.responseStatus(), sunset);
        } else {
            log.info("Deprecated operation used: method={}, path={}, status={}, sunset={}",
                request.method(), request.path(), request.responseStatus(), sunset);
        }
    }

    @Override
    public String toString() {
        return "LoggingTelemetryCallback";
    }
}
