package com.id.gridseries.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One observation of a time series: an absolute instant and a finite measurement.
 */
public record Sample(Instant timestamp, double value) {

    public Sample {
        Objects.requireNonNull(timestamp, "timestamp");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Sample value must be finite, got " + value);
        }
    }

    public static Sample of(Instant timestamp, double value) {
        return new Sample(timestamp, value);
    }
}
