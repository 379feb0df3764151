package com.id.gridseries.modules.ingestion.progress;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingProgressListener implements IngestionProgressListener {

    private final String datasetName;
    private final long intervalRows;
    private long nextReportAt;

    public LoggingProgressListener(String datasetName, long intervalRows) {
        this.datasetName = datasetName;
        this.intervalRows = Math.max(1, intervalRows);
        this.nextReportAt = this.intervalRows;
    }

    @Override
    public void onProgress(IngestionProgress progress) {
        if (progress.rowsProcessed() < nextReportAt) {
            return;
        }
        nextReportAt = (progress.rowsProcessed() / intervalRows + 1) * intervalRows;
        log.info("Transforming '{}': {} rows ({} skipped) | {} rows/s",
                datasetName,
                "%,d".formatted(progress.rowsProcessed()),
                "%,d".formatted(progress.rowsSkipped()),
                "%,.2f".formatted(progress.rowsPerSecond()));
    }
}
