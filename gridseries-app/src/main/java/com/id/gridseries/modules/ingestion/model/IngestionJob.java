package com.id.gridseries.modules.ingestion.model;

import com.id.gridseries.modules.ingestion.model.enums.CsvTimestampFormat;
import com.id.gridseries.modules.ingestion.model.enums.IngestionMode;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.ZoneId;

/**
 * A fully resolved ingestion run: every option set, nothing left to defaults.
 */
@Value
@Builder
public class IngestionJob {

    Path sourcePath;
    String datasetName;
    IngestionMode mode;
    int workerCount;
    double skipThreshold;
    int chunkSize;
    CsvTimestampFormat timestampFormat;
    ZoneId sourceZone;

}
