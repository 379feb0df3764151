package com.id.gridseries.modules.ingestion.progress;

import java.time.Duration;

public record IngestionProgress(long chunksDone, long rowsProcessed, long rowsSkipped, Duration elapsed) {

    public double rowsPerSecond() {
        long millis = elapsed.toMillis();
        return millis > 0 ? rowsProcessed * 1000.0 / millis : 0;
    }
}
