package com.apilifecycle.telemetry;

import com.apilifecycle.engine.LifecycleDecision;
import com.apilifecycle.policy.DeprecationPolicy;
import org.springframework.http.HttpHeaders;

/**
 * Everything a telemetry sink gets to see about one deprecated-usage event.
 *
 * @param request          the request descriptor
 * @param decision         the evaluator's decision
 * @param renderedHeaders  the decision's headers as sent on the wire
 * @param policy           the policy that produced the decision
 */
public record TelemetryContext(
    RequestDescriptor request,
    LifecycleDecision decision,
    HttpHeaders renderedHeaders,
    DeprecationPolicy policy
) {
}
