package com.id.gridseries.modules.ingestion.progress;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LoggingProgressListenerTest {

    @Test
    void rowsPerSecond() {
        assertEquals(2000.0, new IngestionProgress(1, 1000, 0, Duration.ofMillis(500)).rowsPerSecond(), 1e-9);
        assertEquals(0.0, new IngestionProgress(1, 1000, 0, Duration.ZERO).rowsPerSecond(), 1e-9);
    }

    @Test
    void acceptsProgressAtAnyPace() {
        LoggingProgressListener listener = new LoggingProgressListener("volume_frequency_data", 0);
        assertDoesNotThrow(() -> {
            listener.onProgress(new IngestionProgress(1, 10, 0, Duration.ofMillis(1)));
            listener.onProgress(new IngestionProgress(2, 5_000, 3, Duration.ofMillis(2)));
        });
    }
}
