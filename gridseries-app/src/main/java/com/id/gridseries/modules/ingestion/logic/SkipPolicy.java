package com.id.gridseries.modules.ingestion.logic;

import com.id.gridseries.modules.ingestion.exception.IngestionAbortedException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tolerated share of unparsable lines. {@code skipped <= floor(threshold * total)} passes.
 */
public class SkipPolicy {

    private final double threshold;

    public SkipPolicy(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("Skip threshold must be within [0, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    public long allowedSkips(long totalLines) {
        // BigDecimal.valueOf keeps 0.29 as 0.29, a double product would floor 0.29 * 100 to 28
        return BigDecimal.valueOf(threshold)
                .multiply(BigDecimal.valueOf(totalLines))
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
    }

    public void check(long skipped, long totalLines) {
        long allowed = allowedSkips(totalLines);
        if (skipped > allowed) {
            throw new IngestionAbortedException(
                    "Skipped %d of %d lines, more than the %d allowed by threshold %s"
                            .formatted(skipped, totalLines, allowed, threshold));
        }
    }
}
