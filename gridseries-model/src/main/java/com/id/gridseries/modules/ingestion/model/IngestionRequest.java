package com.id.gridseries.modules.ingestion.model;

import com.id.gridseries.modules.ingestion.model.enums.CsvTimestampFormat;
import com.id.gridseries.modules.ingestion.model.enums.IngestionMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options of one ingestion run. Unset fields fall back to the configured defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionRequest {

    private String sourcePath;
    private String datasetName;
    private IngestionMode mode;
    private Integer workerCount;
    private Double skipThreshold;
    private Integer chunkSize;
    private CsvTimestampFormat timestampFormat;
    private String sourceZone;

}
