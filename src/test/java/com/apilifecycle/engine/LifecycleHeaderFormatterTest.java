package com.apilifecycle.engine;

import com.apilifecycle.policy.DateParseException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleHeaderFormatterTest {

    private final LifecycleHeaderFormatter formatter = new LifecycleHeaderFormatter();

    @Test
    void deprecation_isEpochSecondsWithAtSign() {
        assertEquals("@1704067200", formatter.formatDeprecation(Instant.parse("2024-01-01T00:00:00Z")));
        assertEquals("@1704067200", formatter.formatDeprecation(Instant.parse("2024-01-01T00:00:00.999Z")));
    }

    @Test
    void deprecation_roundTrips() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        assertEquals(at, formatter.parseDeprecation(formatter.formatDeprecation(at)));
    }

    @Test
    void sunset_isImfFixdateInGmt() {
        assertEquals("Wed, 01 Jan 2025 00:00:00 GMT", formatter.formatSunset(Instant.parse("2025-01-01T00:00:00Z")));
        assertEquals("Fri, 07 Mar 2025 09:05:03 GMT", formatter.formatSunset(Instant.parse("2025-03-07T09:05:03Z")));
    }

    @Test
    void sunset_roundTrips() {
        Instant at = Instant.parse("2025-03-07T09:05:03Z");
        assertEquals(at, formatter.parseSunset(formatter.formatSunset(at)));
    }

    @Test
    void malformedHeaderValues_areRejected() {
        assertThrows(DateParseException.class, () -> formatter.parseDeprecation("1704067200"));
        assertThrows(DateParseException.class, () -> formatter.parseDeprecation("@soon"));
        assertThrows(DateParseException.class, () -> formatter.parseSunset("next tuesday"));
        assertThrows(DateParseException.class, () -> formatter.parseSunset(null));
    }

    @Test
    void decision_rendersEveryHeaderKind() {
        LifecycleDecision decision = new LifecycleDecision(LifecycleAction.BLOCK_SUNSET, List.of(
            new LifecycleHeader.Deprecation(Instant.parse("2024-01-01T00:00:00Z")),
            new LifecycleHeader.Sunset(Instant.parse("2025-01-01T00:00:00Z")),
            new LifecycleHeader.Link("alternative", URI.create("/new-endpoint")),
            new LifecycleHeader.Link("successor-version", URI.create("https://api.example.com/v2")),
            new LifecycleHeader.CacheTag("legacy"),
            new LifecycleHeader.Location(URI.create("/new-endpoint"))
        ), 301, "moved", null);

        HttpHeaders headers = formatter.format(decision);

        assertEquals("@1704067200", headers.getFirst("Deprecation"));
        assertEquals("Wed, 01 Jan 2025 00:00:00 GMT", headers.getFirst("Sunset"));
        assertEquals(List.of(
            "</new-endpoint>; rel=\"alternative\"",
            "<https://api.example.com/v2>; rel=\"successor-version\""), headers.get(HttpHeaders.LINK));
        assertEquals("legacy", headers.getFirst("Cache-Tag"));
        assertEquals("legacy", headers.getFirst("Surrogate-Key"));
        assertEquals("/new-endpoint", headers.getFirst(HttpHeaders.LOCATION));
    }

    @Test
    void cacheControl_rendersMaxAge() {
        HttpHeaders headers = formatter.format(
            LifecycleDecision.warn(List.of(new LifecycleHeader.CacheControl(3600))));

        assertEquals(List.of("max-age=3600"), headers.get(HttpHeaders.CACHE_CONTROL));
    }

    @Test
    void baseHeaders_comeFirst_andLinkAppends() {
        HttpHeaders base = new HttpHeaders();
        base.add(HttpHeaders.LINK, "</status>; rel=\"status\"");
        base.add("Deprecation", "@0");
        base.add("X-Custom", "kept");

        LifecycleDecision decision = new LifecycleDecision(LifecycleAction.BLOCK_BROWNOUT, List.of(
            new LifecycleHeader.Deprecation(Instant.parse("2024-01-01T00:00:00Z")),
            new LifecycleHeader.Link("alternative", URI.create("/v2"))
        ), 503, null, base);

        HttpHeaders headers = formatter.format(decision);

        assertEquals("kept", headers.getFirst("X-Custom"));
        assertEquals(List.of("@1704067200"), headers.get("Deprecation"));
        assertEquals(List.of("</status>; rel=\"status\"", "</v2>; rel=\"alternative\""), headers.get(HttpHeaders.LINK));
    }

    @Test
    void allowDecision_rendersNothing() {
        assertTrue(formatter.format(LifecycleDecision.allow()).isEmpty());
    }
}
