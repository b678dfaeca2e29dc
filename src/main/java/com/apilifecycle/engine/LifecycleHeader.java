package com.apilifecycle.engine;

import java.net.URI;
import java.time.Instant;

/**
 * Typed header intent produced by the evaluator. Rendering to wire strings is the job of
 * {@link LifecycleHeaderFormatter}; each variant maps to exactly one header entry.
 */
public sealed interface LifecycleHeader {

    /** RFC 9745 Deprecation header. */
    record Deprecation(Instant at) implements LifecycleHeader {}

    /** RFC 8594 Sunset header. */
    record Sunset(Instant at) implements LifecycleHeader {}

    /** One Link entry; multiple relations produce multiple entries. */
    record Link(String relation, URI target) implements LifecycleHeader {}

    record Location(URI target) implements LifecycleHeader {}

    record CacheControl(long maxAgeSeconds) implements LifecycleHeader {}

    /** CDN purge tag, emitted as both Cache-Tag and Surrogate-Key. */
    record CacheTag(String tag) implements LifecycleHeader {}
}
