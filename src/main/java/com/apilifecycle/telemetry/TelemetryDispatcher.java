package com.apilifecycle.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single active telemetry callback and invokes it.
 *
 * - {@link #register} replaces the slot as a whole (last writer wins)
 * - {@link #dispatch} reads the slot once, so a concurrent register never sees a torn state
 * - a failing callback (exception or error, short of a VirtualMachineError) is logged and swallowed;
 *   it can never turn a served response into an error
 *
 * One instance is owned by the application context; tests create their own.
 */
public class TelemetryDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TelemetryDispatcher.class);

    private final AtomicReference<TelemetryCallback> callback = new AtomicReference<>();

    public void register(TelemetryCallback newCallback) {
        TelemetryCallback previous = callback.getAndSet(newCallback);
        if (previous != null && previous != newCallback) {
            log.info("Telemetry callback replaced: {} -> {}", previous, newCallback);
        }
    }

    public void clear() {
        callback.set(null);
    }

    public Optional<TelemetryCallback> registered() {
        return Optional.ofNullable(callback.get());
    }

    /**
     * Notifies the registered callback, if any.
     *
     * @return true when a callback ran to completion, false when none was registered or it failed
     */
    public boolean dispatch(TelemetryContext context) {
        TelemetryCallback current = callback.get();
        if (current == null) {
            return false;
        }
        try {
            current.onDeprecatedUsage(context);
            return true;
        } catch (VirtualMachineError fatal) {
            throw fatal;
        } catch (Throwable ex) {
            TelemetryCallbackException failure = new TelemetryCallbackException(
                "Telemetry callback failed for " + describe(context), ex);
            log.warn(failure.getMessage(), failure);
            return false;
        }
    }

    private static String describe(TelemetryContext context) {
        if (context == null || context.request() == null) {
            return "unknown request";
        }
        return context.request().method() + " " + context.request().path();
    }
}
