package com.apilifecycle.engine;

import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Optional;

/**
 * Per-evaluation result: what to do with the request and which headers to attach.
 *
 * @param action      allow, warn or one of the blocking actions
 * @param headers     lifecycle headers in emission order
 * @param statusCode  response status for blocking actions, null otherwise
 * @param body        response body for blocking actions, null otherwise
 * @param baseHeaders headers carried over from an override response (empty when none)
 */
public record LifecycleDecision(
    LifecycleAction action,
    List<LifecycleHeader> headers,
    Integer statusCode,
    Object body,
    HttpHeaders baseHeaders
) {

    private static final LifecycleDecision ALLOW =
        new LifecycleDecision(LifecycleAction.ALLOW, List.of(), null, null, HttpHeaders.EMPTY);

    public LifecycleDecision {
        headers = headers == null ? List.of() : List.copyOf(headers);
        baseHeaders = baseHeaders == null ? HttpHeaders.EMPTY : HttpHeaders.readOnlyHttpHeaders(baseHeaders);
    }

    public static LifecycleDecision allow() {
        return ALLOW;
    }

    public static LifecycleDecision warn(List<LifecycleHeader> headers) {
        return new LifecycleDecision(LifecycleAction.WARN, headers, null, null, HttpHeaders.EMPTY);
    }

    public boolean isBlocking() {
        return action.isBlocking();
    }

    public Optional<Integer> status() {
        return Optional.ofNullable(statusCode);
    }

    public Optional<Object> bodyValue() {
        return Optional.ofNullable(body);
    }

    /** Whether the caller should hand this decision to telemetry. */
    public boolean isTelemetered() {
        return action != LifecycleAction.ALLOW;
    }
}
