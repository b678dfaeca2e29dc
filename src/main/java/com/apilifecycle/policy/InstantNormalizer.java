package com.apilifecycle.policy;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Converts the date shapes accepted at policy-construction time into UTC {@link Instant}s.
 *
 * Accepted inputs:
 * - ISO-8601 strings: date-only (midnight UTC), local date-time (UTC assumed),
 *   offset date-time (converted to UTC). A space is tolerated in place of 'T'; offsets may be
 *   written as 'Z', '+02:00', '+0200' or '+02'.
 * - RFC 1123 HTTP-date strings, so a Sunset header value can be fed back.
 * - java.time values and {@link Date}
 * - numbers, read as seconds since the Unix epoch (fractions allowed)
 */
public final class InstantNormalizer {

    private static final DateTimeFormatter ISO_DATE_TIME = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        .appendPattern("[XXX][XX][X]")
        .toFormatter();

    private InstantNormalizer() {}

    public static Instant normalize(Object input) {
        if (input == null) {
            throw new DateParseException("date input must not be null");
        }
        if (input instanceof String text) {
            return normalize(text);
        }
        if (input instanceof Instant instant) {
            return instant;
        }
        if (input instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (input instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (input instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        if (input instanceof LocalDate localDate) {
            return localDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (input instanceof Date date) {
            return date.toInstant();
        }
        if (input instanceof Double || input instanceof Float) {
            return normalize(((Number) input).doubleValue());
        }
        if (input instanceof Number number) {
            return normalize(number.longValue());
        }
        throw new DateParseException("Unsupported date type: " + input.getClass().getName());
    }

    public static Instant normalize(String input) {
        if (input == null || input.isBlank()) {
            throw new DateParseException("date string must not be blank");
        }
        String text = input.trim();

        if (Character.isLetter(text.charAt(0))) {
            try {
                return ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                throw new DateParseException("Invalid date string: " + input, e);
            }
        }

        String iso = text.length() > 10 && text.charAt(10) == ' '
            ? text.substring(0, 10) + 'T' + text.substring(11)
            : text;

        try {
            if (iso.length() == 10) {
                return LocalDate.parse(iso).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = ISO_DATE_TIME.parseBest(iso, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new DateParseException("Invalid date string: " + input, e);
        }
    }

    public static Instant normalize(long epochSeconds) {
        try {
            return Instant.ofEpochSecond(epochSeconds);
        } catch (DateTimeException e) {
            throw new DateParseException("Epoch seconds out of range: " + epochSeconds, e);
        }
    }

    public static Instant normalize(double epochSeconds) {
        if (Double.isNaN(epochSeconds) || Double.isInfinite(epochSeconds)) {
            throw new DateParseException("Invalid epoch seconds: " + epochSeconds);
        }
        // Checked before the long cast, which would saturate silently.
        if (epochSeconds < Instant.MIN.getEpochSecond() || epochSeconds > Instant.MAX.getEpochSecond()) {
            throw new DateParseException("Epoch seconds out of range: " + epochSeconds);
        }
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000L);
        try {
            return Instant.ofEpochSecond(seconds, nanos);
        } catch (DateTimeException | ArithmeticException e) {
            throw new DateParseException("Epoch seconds out of range: " + epochSeconds, e);
        }
    }
}
