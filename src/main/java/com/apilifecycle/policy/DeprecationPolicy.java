package com.apilifecycle.policy;

import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of one operation's (or one path prefix's) lifecycle.
 *
 * All temporal invariants are checked here, once:
 * - sunsetAt must not be earlier than deprecationAt
 * - every brownout window must have start < end (overlaps are allowed)
 * - brownoutProbability must lie in [0, 1]
 * - progressiveBrownout needs both deprecationAt and sunsetAt
 *
 * Optional components are null when absent; use the Optional-returning accessors
 * ({@link #deprecation()}, {@link #sunset()}, ...) in calling code.
 */
public record DeprecationPolicy(
    Instant deprecationAt,
    Instant sunsetAt,
    URI alternative,
    Map<String, URI> links,
    String detail,
    List<Brownout> brownouts,
    boolean injectCacheControl,
    ResponseEntity<?> overrideResponse,
    String cacheTag,
    double brownoutProbability,
    boolean progressiveBrownout
) {

    public static final String DEFAULT_DETAIL = "Endpoint is deprecated and no longer available.";

    /** Link relation used for the deprecation documentation link (RFC 9745 §3). */
    public static final String DEPRECATION_RELATION = "deprecation";

    public DeprecationPolicy {
        if (deprecationAt != null && sunsetAt != null && sunsetAt.isBefore(deprecationAt)) {
            throw new PolicyValidationException(
                "sunset " + sunsetAt + " cannot be earlier than deprecation " + deprecationAt);
        }
        if (Double.isNaN(brownoutProbability) || brownoutProbability < 0.0 || brownoutProbability > 1.0) {
            throw new PolicyValidationException(
                "brownoutProbability must be within [0, 1], got " + brownoutProbability);
        }
        if (progressiveBrownout && (deprecationAt == null || sunsetAt == null)) {
            throw new PolicyValidationException(
                "progressiveBrownout requires both a deprecation and a sunset date");
        }
        links = links == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(links));
        brownouts = brownouts == null ? List.of() : List.copyOf(brownouts);
        detail = detail == null || detail.isBlank() ? DEFAULT_DETAIL : detail;
        cacheTag = cacheTag == null || cacheTag.isBlank() ? null : cacheTag;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Instant> deprecation() {
        return Optional.ofNullable(deprecationAt);
    }

    public Optional<Instant> sunset() {
        return Optional.ofNullable(sunsetAt);
    }

    public Optional<URI> alternativeUri() {
        return Optional.ofNullable(alternative);
    }

    public Optional<ResponseEntity<?>> override() {
        return Optional.ofNullable(overrideResponse);
    }

    public Optional<String> tag() {
        return Optional.ofNullable(cacheTag);
    }

    /** Whether any probabilistic brownout is configured. */
    public boolean hasChaosBrownout() {
        return progressiveBrownout || brownoutProbability > 0.0;
    }

    /**
     * Fluent builder. Date setters accept any input understood by {@link InstantNormalizer}
     * and normalize immediately, so malformed dates fail here rather than at request time.
     */
    public static final class Builder {

        private Instant deprecationAt;
        private Instant sunsetAt;
        private URI alternative;
        private final Map<String, URI> links = new LinkedHashMap<>();
        private String detail;
        private final List<Brownout> brownouts = new ArrayList<>();
        private boolean injectCacheControl;
        private ResponseEntity<?> overrideResponse;
        private String cacheTag;
        private double brownoutProbability;
        private boolean progressiveBrownout;

        private Builder() {}

        public Builder deprecationAt(Object date) {
            this.deprecationAt = date == null ? null : InstantNormalizer.normalize(date);
            return this;
        }

        public Builder sunsetAt(Object date) {
            this.sunsetAt = date == null ? null : InstantNormalizer.normalize(date);
            return this;
        }

        public Builder alternative(String uri) {
            this.alternative = uri == null ? null : toUri(uri, "alternative");
            return this;
        }

        public Builder alternative(URI uri) {
            this.alternative = uri;
            return this;
        }

        public Builder link(String relation, String uri) {
            Objects.requireNonNull(relation, "relation");
            this.links.put(relation, toUri(Objects.requireNonNull(uri, "uri"), relation));
            return this;
        }

        public Builder links(Map<String, String> links) {
            if (links == null) return this;
            links.forEach(this::link);
            return this;
        }

        /** Shortcut for the {@code deprecation} link relation pointing at migration docs. */
        public Builder deprecationLink(String uri) {
            return link(DEPRECATION_RELATION, uri);
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder brownout(Object start, Object end) {
            this.brownouts.add(Brownout.of(start, end));
            return this;
        }

        public Builder brownout(Brownout brownout) {
            this.brownouts.add(Objects.requireNonNull(brownout, "brownout"));
            return this;
        }

        public Builder injectCacheControl(boolean inject) {
            this.injectCacheControl = inject;
            return this;
        }

        public Builder overrideResponse(ResponseEntity<?> response) {
            this.overrideResponse = response;
            return this;
        }

        public Builder cacheTag(String tag) {
            this.cacheTag = tag;
            return this;
        }

        public Builder brownoutProbability(double probability) {
            this.brownoutProbability = probability;
            return this;
        }

        public Builder progressiveBrownout(boolean progressive) {
            this.progressiveBrownout = progressive;
            return this;
        }

        public DeprecationPolicy build() {
            return new DeprecationPolicy(deprecationAt, sunsetAt, alternative, links, detail,
                brownouts, injectCacheControl, overrideResponse, cacheTag,
                brownoutProbability, progressiveBrownout);
        }

        private static URI toUri(String value, String field) {
            if (value.isBlank()) {
                throw new PolicyValidationException(field + " must not be blank");
            }
            try {
                return URI.create(value);
            } catch (IllegalArgumentException e) {
                throw new PolicyValidationException(field + " is not a valid URI: " + value);
            }
        }
    }
}
