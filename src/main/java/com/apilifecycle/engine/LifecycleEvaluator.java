package com.apilifecycle.engine;

import com.apilifecycle.policy.Brownout;
import com.apilifecycle.policy.DeprecationPolicy;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic lifecycle state machine: (policy, now) -> decision.
 *
 * Conditions are checked in priority order and the first one that fires wins:
 * 1. sunset reached (now >= sunsetAt)             -> BLOCK_SUNSET, even inside a brownout
 * 2. scheduled brownout active (start <= now < end) -> BLOCK_BROWNOUT
 * 3. chaos brownout drawn (only when the policy enables one and deprecation has begun)
 *                                                  -> BLOCK_BROWNOUT
 * 4. no deprecation date                          -> ALLOW, no headers
 * 5. otherwise                                    -> WARN, whether the deprecation is past or future
 *
 * Blocking decisions keep the full Deprecation/Sunset/Link description of the policy.
 * The evaluator never throws for a constructed policy; validation already happened there.
 */
public class LifecycleEvaluator {

    private final Clock clock;
    private final BrownoutSampler sampler;

    public LifecycleEvaluator(Clock clock, BrownoutSampler sampler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
    }

    public LifecycleEvaluator(Clock clock) {
        this(clock, BrownoutSampler.random());
    }

    /** Evaluates against the injected clock, read fresh on every call. */
    public LifecycleDecision evaluate(DeprecationPolicy policy) {
        return evaluate(policy, clock.instant());
    }

    public LifecycleDecision evaluate(DeprecationPolicy policy, Instant now) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(now, "now");

        if (policy.sunsetAt() != null && !now.isBefore(policy.sunsetAt())) {
            return block(LifecycleAction.BLOCK_SUNSET, policy);
        }
        for (Brownout brownout : policy.brownouts()) {
            if (brownout.isActiveAt(now)) {
                return block(LifecycleAction.BLOCK_BROWNOUT, policy);
            }
        }
        if (policy.hasChaosBrownout() && chaosBrownoutDrawn(policy, now)) {
            return block(LifecycleAction.BLOCK_BROWNOUT, policy);
        }
        if (policy.deprecationAt() == null) {
            return LifecycleDecision.allow();
        }

        List<LifecycleHeader> headers = describe(policy);
        if (policy.injectCacheControl() && policy.sunsetAt() != null) {
            long seconds = Math.max(0L, Duration.between(now, policy.sunsetAt()).getSeconds());
            headers.add(new LifecycleHeader.CacheControl(seconds));
        }
        addCacheTag(policy, headers);
        return LifecycleDecision.warn(headers);
    }

    /**
     * Probability of a chaos brownout at {@code now}. Zero before the deprecation date;
     * progressive policies ramp linearly from 0 at deprecation to 1 at sunset.
     */
    static double chaosProbability(DeprecationPolicy policy, Instant now) {
        if (policy.deprecationAt() == null || now.isBefore(policy.deprecationAt())) {
            return 0.0;
        }
        if (policy.progressiveBrownout()) {
            double total = seconds(Duration.between(policy.deprecationAt(), policy.sunsetAt()));
            if (total <= 0.0) {
                return 0.0;
            }
            double elapsed = seconds(Duration.between(policy.deprecationAt(), now));
            return Math.min(1.0, elapsed / total);
        }
        return policy.brownoutProbability();
    }

    // Fractional seconds; toMillis() overflows for far-apart instants.
    private static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }

    private boolean chaosBrownoutDrawn(DeprecationPolicy policy, Instant now) {
        double probability = chaosProbability(policy, now);
        return probability > 0.0 && sampler.sample() < probability;
    }

    private LifecycleDecision block(LifecycleAction action, DeprecationPolicy policy) {
        List<LifecycleHeader> headers = describe(policy);
        addCacheTag(policy, headers);

        ResponseEntity<?> override = policy.overrideResponse();
        if (override != null) {
            return new LifecycleDecision(action, headers, override.getStatusCode().value(),
                override.getBody(), override.getHeaders());
        }

        URI alternative = policy.alternative();
        if (alternative != null) {
            headers.add(new LifecycleHeader.Location(alternative));
            return new LifecycleDecision(action, headers, 301, policy.detail(), HttpHeaders.EMPTY);
        }
        return new LifecycleDecision(action, headers, 410, policy.detail(), HttpHeaders.EMPTY);
    }

    // Deprecation, Sunset and Link entries, shared by the warn and blocking shapes.
    private static List<LifecycleHeader> describe(DeprecationPolicy policy) {
        List<LifecycleHeader> headers = new ArrayList<>();
        if (policy.deprecationAt() != null) {
            headers.add(new LifecycleHeader.Deprecation(policy.deprecationAt()));
        }
        if (policy.sunsetAt() != null) {
            headers.add(new LifecycleHeader.Sunset(policy.sunsetAt()));
        }
        if (policy.alternative() != null) {
            headers.add(new LifecycleHeader.Link("alternative", policy.alternative()));
        }
        for (Map.Entry<String, URI> link : policy.links().entrySet()) {
            headers.add(new LifecycleHeader.Link(link.getKey(), link.getValue()));
        }
        return headers;
    }

    private static void addCacheTag(DeprecationPolicy policy, List<LifecycleHeader> headers) {
        if (policy.cacheTag() != null) {
            headers.add(new LifecycleHeader.CacheTag(policy.cacheTag()));
        }
    }
}
