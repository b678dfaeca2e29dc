package com.apilifecycle.engine;

import com.apilifecycle.policy.DateParseException;
import org.springframework.http.HttpHeaders;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Renders a {@link LifecycleDecision} into wire-exact header values.
 *
 * Formats:
 * - Deprecation:   {@code @1704067200} (RFC 9745, integer epoch seconds)
 * - Sunset:        {@code Wed, 01 Jan 2025 00:00:00 GMT} (RFC 7231 IMF-fixdate)
 * - Link:          {@code </new>; rel="alternative"}, one entry per relation
 * - Location:      raw URI
 * - Cache-Control: {@code max-age=3600}
 * - Cache-Tag / Surrogate-Key: the tag verbatim
 *
 * Rendering never adds or drops a header relative to the decision. Headers from an override
 * response come first; lifecycle values replace same-named ones, except Link which appends.
 */
public class LifecycleHeaderFormatter {

    public static final String DEPRECATION = "Deprecation";
    public static final String SUNSET = "Sunset";
    public static final String CACHE_TAG = "Cache-Tag";
    public static final String SURROGATE_KEY = "Surrogate-Key";

    // RFC_1123_DATE_TIME does not zero-pad the day of month, IMF-fixdate requires it.
    private static final DateTimeFormatter HTTP_DATE =
        DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    public HttpHeaders format(LifecycleDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(decision.baseHeaders());
        for (LifecycleHeader header : decision.headers()) {
            apply(header, headers);
        }
        return headers;
    }

    public String formatDeprecation(Instant at) {
        return "@" + at.getEpochSecond();
    }

    public String formatSunset(Instant at) {
        return HTTP_DATE.format(at);
    }

    public String formatLink(String relation, String target) {
        return "<" + target + ">; rel=\"" + relation + "\"";
    }

    /** Inverse of {@link #formatDeprecation(Instant)}. */
    public Instant parseDeprecation(String value) {
        if (value == null || !value.startsWith("@")) {
            throw new DateParseException("Deprecation value must look like @<epoch-seconds>: " + value);
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(value.substring(1)));
        } catch (NumberFormatException e) {
            throw new DateParseException("Invalid Deprecation value: " + value, e);
        }
    }

    /** Inverse of {@link #formatSunset(Instant)}. */
    public Instant parseSunset(String value) {
        if (value == null) {
            throw new DateParseException("Sunset value must not be null");
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new DateParseException("Invalid Sunset value: " + value, e);
        }
    }

    private void apply(LifecycleHeader header, HttpHeaders headers) {
        if (header instanceof LifecycleHeader.Deprecation deprecation) {
            headers.set(DEPRECATION, formatDeprecation(deprecation.at()));
        } else if (header instanceof LifecycleHeader.Sunset sunset) {
            headers.set(SUNSET, formatSunset(sunset.at()));
        } else if (header instanceof LifecycleHeader.Link link) {
            headers.add(HttpHeaders.LINK, formatLink(link.relation(), link.target().toString()));
        } else if (header instanceof LifecycleHeader.Location location) {
            headers.set(HttpHeaders.LOCATION, location.target().toString());
        } else if (header instanceof LifecycleHeader.CacheControl cacheControl) {
            headers.set(HttpHeaders.CACHE_CONTROL, "max-age=" + cacheControl.maxAgeSeconds());
        } else if (header instanceof LifecycleHeader.CacheTag cacheTag) {
            headers.set(CACHE_TAG, cacheTag.tag());
            headers.set(SURROGATE_KEY, cacheTag.tag());
        }
    }
}
