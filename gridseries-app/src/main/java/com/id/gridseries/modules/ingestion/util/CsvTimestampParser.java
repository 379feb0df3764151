package com.id.gridseries.modules.ingestion.util;

import com.id.gridseries.modules.ingestion.model.enums.CsvTimestampFormat;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the timestamp column of a CSV line into an {@link Instant}.
 * Stateless and safe to share between worker threads.
 */
public final class CsvTimestampParser {

    private static final DateTimeFormatter YYYY_MM_DD_HH_MM_SS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    // Swissgrid export: "Sa. 01.05.21 00:00:30", the weekday abbreviation is locale dependent and ignored
    private static final Pattern DD_MM_YY_HH_MM_SS =
            Pattern.compile("(\\d{2})\\.(\\d{2})\\.(\\d{2}|\\d{4})\\s+(\\d{2}):(\\d{2}):(\\d{2})(?:\\.(\\d{1,9}))?");

    private CsvTimestampParser() {
    }

    public static CsvTimestampFormat resolveFormat(Object raw) {
        if (raw == null) {
            return CsvTimestampFormat.AUTO;
        }
        String normalized = raw.toString().trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return CsvTimestampFormat.AUTO;
        }
        try {
            return CsvTimestampFormat.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown timestamp format: " + raw, ex);
        }
    }

    public static Optional<Instant> parse(String value, CsvTimestampFormat format, ZoneId zone) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        return switch (format) {
            case AUTO -> parseIso(trimmed, zone).or(() -> parseSwissgrid(trimmed, zone));
            case ISO_8601 -> parseIso(trimmed, zone);
            case DD_MM_YY_HH_MM_SS -> parseSwissgrid(trimmed, zone);
            case YYYY_MM_DD_HH_MM_SS -> parseLocal(trimmed, YYYY_MM_DD_HH_MM_SS, zone);
            case EPOCH_MILLIS -> parseEpochMillis(trimmed);
            case EPOCH_SECONDS -> parseEpochSeconds(trimmed);
        };
    }

    private static Optional<Instant> parseIso(String value, ZoneId zone) {
        String iso = value.indexOf('T') < 0 && value.length() > 10 && value.charAt(10) == ' '
                ? value.substring(0, 10) + 'T' + value.substring(11)
                : value;
        try {
            return Optional.of(OffsetDateTime.parse(iso).toInstant());
        } catch (DateTimeParseException ignored) {
            // no offset, fall through to the zone-less forms
        }
        return parseLocal(iso, DateTimeFormatter.ISO_LOCAL_DATE_TIME, zone);
    }

    private static Optional<Instant> parseSwissgrid(String value, ZoneId zone) {
        Matcher m = DD_MM_YY_HH_MM_SS.matcher(value);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            int year = Integer.parseInt(m.group(3));
            if (m.group(3).length() == 2) {
                year += 2000;
            }
            int nanos = 0;
            if (m.group(7) != null) {
                String fraction = (m.group(7) + "000000000").substring(0, 9);
                nanos = Integer.parseInt(fraction);
            }
            LocalDateTime ldt = LocalDateTime.of(
                    year,
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(4)),
                    Integer.parseInt(m.group(5)),
                    Integer.parseInt(m.group(6)),
                    nanos);
            return Optional.of(ldt.atZone(zone).toInstant());
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseLocal(String value, DateTimeFormatter formatter, ZoneId zone) {
        try {
            return Optional.of(LocalDateTime.parse(value, formatter).atZone(zone).toInstant());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseEpochMillis(String value) {
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
        } catch (NumberFormatException | DateTimeException ex) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseEpochSeconds(String value) {
        try {
            double seconds = Double.parseDouble(value);
            if (!Double.isFinite(seconds)) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochMilli((long) Math.floor(seconds * 1000L)));
        } catch (NumberFormatException | DateTimeException ex) {
            return Optional.empty();
        }
    }
}
