package com.id.gridseries.modules.ingestion.model;

import com.id.gridseries.modules.ingestion.model.enums.IngestionMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionSummary {

    private String datasetName;
    private IngestionMode mode;
    @Builder.Default
    private long rowsRead = 0;
    @Builder.Default
    private long rowsSkipped = 0;
    @Builder.Default
    private long rowsLoaded = 0;
    @Builder.Default
    private long chunks = 0;
    @Builder.Default
    private int workerCount = 0;
    @Builder.Default
    private long elapsedMillis = 0;

    public double getRowsPerSecond() {
        if (elapsedMillis <= 0) {
            return rowsLoaded;
        }
        return rowsLoaded * 1000.0 / elapsedMillis;
    }
}
