package com.apilifecycle.policy;

import java.time.Instant;
import java.util.Objects;

/**
 * A scheduled, temporary blocking window ahead of the final sunset.
 * The window is half-open: it covers {@code start <= t < end}.
 */
public record Brownout(Instant start, Instant end) {

    public Brownout {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new PolicyValidationException(
                "brownout start must be before end, got start=" + start + ", end=" + end);
        }
    }

    /** Builds a window from any date input accepted by {@link InstantNormalizer}. */
    public static Brownout of(Object start, Object end) {
        return new Brownout(InstantNormalizer.normalize(start), InstantNormalizer.normalize(end));
    }

    public boolean isActiveAt(Instant now) {
        return !now.isBefore(start) && now.isBefore(end);
    }
}
