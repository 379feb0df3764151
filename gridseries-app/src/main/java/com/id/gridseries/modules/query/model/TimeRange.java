package com.id.gridseries.modules.query.model;

import com.id.gridseries.modules.query.exception.InvalidRangeException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Closed interval {@code [start, end]}; {@code start == end} is a valid single-instant range.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new InvalidRangeException("Start and end time are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidRangeException("start_time %s is after end_time %s".formatted(start, end));
        }
    }

    public static TimeRange parse(String startTime, String endTime) {
        return new TimeRange(parseInstant("start_time", startTime), parseInstant("end_time", endTime));
    }

    // ISO-8601 with 'Z' or an offset; without one the value is taken as UTC
    static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRangeException(name + " is required");
        }
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the zone-less form below
        }
        try {
            return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException(
                    "Invalid %s '%s'. Use ISO 8601 (e.g., 2024-01-01T00:00:00Z).".formatted(name, value), e);
        }
    }
}
