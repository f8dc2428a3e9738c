package com.example.itinerary.assistant.query;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Lenient ISO-8601 parsing for event dates. Values without an offset are read as UTC.
 */
public final class IsoDates {

    private IsoDates() {}

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim();
        try {
            return Optional.of(OffsetDateTime.parse(v).toInstant());
        } catch (DateTimeParseException ignored) {
            // fall through to the offset-less forms
        }
        try {
            return Optional.of(LocalDateTime.parse(v).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return Optional.of(LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }

    /** Epoch millis, or 0 when the value does not parse. */
    public static long epochMillisOrZero(String value) {
        return parse(value).map(Instant::toEpochMilli).orElse(0L);
    }

    /** The calendar-date part of an ISO timestamp (everything before {@code T}). */
    public static String datePart(String value) {
        if (value == null) return "";
        int t = value.indexOf('T');
        return t >= 0 ? value.substring(0, t) : value;
    }
}
