package com.apilifecycle.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class InstantNormalizerTest {

    private static final Instant NEW_YEAR_2024 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void dateOnlyString_isMidnightUtc() {
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize("2024-01-01"));
    }

    @Test
    void dateTimeWithoutOffset_isTreatedAsUtc() {
        assertEquals(Instant.parse("2024-01-01T10:30:00Z"), InstantNormalizer.normalize("2024-01-01T10:30:00"));
        assertEquals(Instant.parse("2024-01-01T10:30:00Z"), InstantNormalizer.normalize("2024-01-01 10:30:00"));
    }

    @Test
    void dateTimeWithOffset_isConvertedToUtc() {
        assertEquals(Instant.parse("2024-01-01T08:00:00Z"), InstantNormalizer.normalize("2024-01-01T10:00:00+02:00"));
        assertEquals(Instant.parse("2024-01-01T15:00:00Z"), InstantNormalizer.normalize("2024-01-01T10:00:00-05:00"));
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize("2024-01-01T00:00:00Z"));
    }

    @Test
    void compactOffsets_areAccepted() {
        Instant expected = Instant.parse("2024-01-01T08:00:00Z");
        assertEquals(expected, InstantNormalizer.normalize("2024-01-01T10:00:00+0200"));
        assertEquals(expected, InstantNormalizer.normalize("2024-01-01T10:00:00+02"));
        assertEquals(expected, InstantNormalizer.normalize("2024-01-01 10:00:00+02"));
        assertEquals(Instant.parse("2024-01-01T15:30:00Z"), InstantNormalizer.normalize("2024-01-01T10:00:00-0530"));
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize("2024-01-01t00:00:00z"));
    }

    @Test
    void httpDateString_isAccepted() {
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"),
            InstantNormalizer.normalize("Wed, 01 Jan 2025 00:00:00 GMT"));
    }

    @Test
    void epochSeconds_areAccepted() {
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize(1704067200L));
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize((Object) 1704067200));
        assertEquals(NEW_YEAR_2024.plusMillis(500), InstantNormalizer.normalize(1704067200.5d));
    }

    @Test
    void javaTimeValues_areNormalized() {
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize(LocalDate.of(2024, 1, 1)));
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize(LocalDateTime.of(2024, 1, 1, 0, 0)));
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize(
            OffsetDateTime.of(2024, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(1))));
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize(
            ZonedDateTime.of(2023, 12, 31, 19, 0, 0, 0, ZoneId.of("America/New_York"))));
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize(Date.from(NEW_YEAR_2024)));
        assertEquals(NEW_YEAR_2024, InstantNormalizer.normalize((Object) NEW_YEAR_2024));
    }

    @Test
    @DisplayName("Malformed, blank and unsupported inputs raise DateParseException")
    void invalidInputs_areRejected() {
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize("not-a-date"));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize("2024-13-01"));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize("  "));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize("Someday, 99 Foo 2025"));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize((Object) null));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize(new Object()));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize(Double.NaN));
    }

    @Test
    void outOfRangeEpochSeconds_areRejected() {
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize(Long.MAX_VALUE));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize(Long.MIN_VALUE));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize(1e20d));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize(-1e20d));
        assertThrows(DateParseException.class, () -> InstantNormalizer.normalize((Object) Long.MAX_VALUE));
        assertThrows(DateParseException.class, () -> DeprecationPolicy.builder().sunsetAt(1e20d));
    }
}
