package com.apilifecycle.config;

import com.apilifecycle.policy.DeprecationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * Deprecation policies declared in application configuration.
 *
 * <pre>
 * lifecycle:
 *   telemetry:
 *     log-usage: true
 *   policies:
 *     - prefix: /v1                 # or: method + path for a single operation
 *       deprecation: "2024-01-01"
 *       sunset: "2025-01-01T00:00:00Z"
 *       alternative: /v2
 *       links:
 *         successor-version: /docs/v2
 *       brownouts:
 *         - start: "2024-11-01T09:00:00Z"
 *           end: "2024-11-01T10:00:00Z"
 * </pre>
 */
@ConfigurationProperties(prefix = "lifecycle")
public record LifecycleProperties(
    List<PolicyEntry> policies,
    Telemetry telemetry
) {

    public LifecycleProperties {
        policies = policies == null ? List.of() : List.copyOf(policies);
        telemetry = telemetry == null ? new Telemetry(true) : telemetry;
    }

    public record Telemetry(@DefaultValue("true") boolean logUsage) {}

    public record Window(String start, String end) {}

    public record PolicyEntry(
        String prefix,
        String method,
        String path,
        String deprecation,
        String sunset,
        String alternative,
        String deprecationLink,
        Map<String, String> links,
        String detail,
        List<Window> brownouts,
        boolean injectCacheControl,
        String cacheTag,
        double brownoutProbability,
        boolean progressiveBrownout
    ) {

        public boolean isPrefixEntry() {
            return prefix != null && !prefix.isBlank();
        }

        public String describe() {
            return isPrefixEntry() ? "prefix " + prefix : (method == null ? "*" : method) + " " + path;
        }

        /** Dates are normalized here, so a malformed entry fails application startup. */
        public DeprecationPolicy toPolicy() {
            DeprecationPolicy.Builder builder = DeprecationPolicy.builder()
                .deprecationAt(deprecation)
                .sunsetAt(sunset)
                .alternative(alternative)
                .links(links)
                .detail(detail)
                .injectCacheControl(injectCacheControl)
                .cacheTag(cacheTag)
                .brownoutProbability(brownoutProbability)
                .progressiveBrownout(progressiveBrownout);
            if (deprecationLink != null) {
                builder.deprecationLink(deprecationLink);
            }
            if (brownouts != null) {
                for (Window window : brownouts) {
                    builder.brownout(window.start(), window.end());
                }
            }
            return builder.build();
        }
    }
}
