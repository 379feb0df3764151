package com.id.gridseries.modules.query.model;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A fixed time step, written as {@code <n><unit>} ({@code 1ms}, {@code 30s}, {@code 15m}, {@code 1h}, {@code 1d})
 * or as an ISO-8601 duration ({@code PT30S}).
 */
public record Resolution(Duration step, String label) {

    private static final Pattern SHORT_FORM = Pattern.compile("(\\d{1,9})\\s*(ms|s|m|h|d)");

    public Resolution {
        if (step == null || step.isNegative() || step.isZero() || toMillis(step) < 1) {
            throw new IllegalArgumentException("Resolution must be at least 1ms, got " + step);
        }
    }

    private static long toMillis(Duration step) {
        try {
            return step.toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Resolution " + step + " is too large", e);
        }
    }

    public static Resolution of(Duration step) {
        return new Resolution(step, step.toString());
    }

    public static Resolution parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Resolution cannot be empty");
        }
        String text = raw.trim().toLowerCase(Locale.ROOT);
        Matcher m = SHORT_FORM.matcher(text);
        if (m.matches()) {
            long amount = Long.parseLong(m.group(1));
            Duration step = switch (m.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                case "d" -> Duration.ofDays(amount);
                default -> throw new IllegalArgumentException("Unknown resolution unit in '" + raw + "'");
            };
            return new Resolution(step, text);
        }
        try {
            return new Resolution(Duration.parse(raw.trim().toUpperCase(Locale.ROOT)), raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid resolution '" + raw + "', expected e.g. 30s, 15m, 1h", e);
        }
    }

    /**
     * The coarser of the two; equal steps keep {@code this}.
     */
    public Resolution atLeast(Resolution other) {
        return other.step.compareTo(step) > 0 ? other : this;
    }

    @Override
    public String toString() {
        return label;
    }
}
