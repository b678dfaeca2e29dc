package com.apilifecycle.api;

import com.apilifecycle.engine.LifecycleAction;
import com.apilifecycle.engine.LifecycleDecision;
import com.apilifecycle.engine.LifecycleEvaluator;
import com.apilifecycle.engine.LifecycleHeaderFormatter;
import com.apilifecycle.policy.DeprecationPolicy;
import com.apilifecycle.policy.OperationKey;
import com.apilifecycle.policy.PolicyResolver;
import com.apilifecycle.telemetry.RequestDescriptor;
import com.apilifecycle.telemetry.TelemetryContext;
import com.apilifecycle.telemetry.TelemetryDispatcher;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.Optional;

/**
 * Applies lifecycle decisions to every HTTP request whose operation or path prefix has a policy.
 *
 * - warn:  lifecycle headers are added before the handler runs, the request proceeds
 * - block: the handler is skipped, a 410/301 (or the override response) is written instead
 * - telemetry is dispatched after the response status is known (500 if the handler chain threw)
 *
 * Policies are resolved on the decoded path with ';' parameters removed, the same path handler
 * mapping matches on, so percent-encoding or matrix parameters cannot bypass a block.
 *
 * Runs ahead of handler mapping, so prefixes whose handlers were already removed still answer
 * with the sunset response rather than a bare 404.
 */
@Component
public class DeprecationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(DeprecationFilter.class);

    private final PolicyResolver policyResolver;
    private final LifecycleEvaluator evaluator;
    private final LifecycleHeaderFormatter formatter;
    private final TelemetryDispatcher telemetry;
    private final BlockingResponseWriter responseWriter;

    public DeprecationFilter(PolicyResolver policyResolver,
                             LifecycleEvaluator evaluator,
                             LifecycleHeaderFormatter formatter,
                             TelemetryDispatcher telemetry,
                             BlockingResponseWriter responseWriter) {
        this.policyResolver = policyResolver;
        this.evaluator = evaluator;
        this.formatter = formatter;
        this.telemetry = telemetry;
        this.responseWriter = responseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String path = pathWithinApplication(request);
        Optional<DeprecationPolicy> policy = policyResolver.resolve(OperationKey.of(request.getMethod(), path));
        if (policy.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }

        LifecycleDecision decision = evaluator.evaluate(policy.get());
        if (decision.action() == LifecycleAction.ALLOW) {
            chain.doFilter(request, response);
            return;
        }

        HttpHeaders headers = formatter.format(decision);
        if (decision.isBlocking()) {
            log.debug("Blocking {} {} with action={} status={}",
                request.getMethod(), path, decision.action().getValue(), decision.statusCode());
            responseWriter.write(response, decision, headers, policy.get());
            dispatch(request.getMethod(), path, response.getStatus(), decision, headers, policy.get());
            return;
        }

        headers.forEach((name, values) -> values.forEach(value -> response.addHeader(name, value)));
        boolean completed = false;
        try {
            chain.doFilter(request, response);
            completed = true;
        } finally {
            int status = completed ? response.getStatus() : HttpStatus.INTERNAL_SERVER_ERROR.value();
            dispatch(request.getMethod(), path, status, decision, headers, policy.get());
        }
    }

    private void dispatch(String method, String path, int status, LifecycleDecision decision,
                          HttpHeaders headers, DeprecationPolicy policy) {
        telemetry.dispatch(new TelemetryContext(
            new RequestDescriptor(method, path, status), decision, headers, policy));
    }

    static String pathWithinApplication(HttpServletRequest request) {
        // defaultInstance decodes and strips ';' content.
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        return path.isEmpty() ? "/" : path;
    }
}
