package com.id.gridseries.config;

import com.id.gridseries.modules.ingestion.model.enums.CsvTimestampFormat;
import com.id.gridseries.modules.ingestion.model.enums.IngestionMode;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AppConfig {

    // 0 means one worker per available processor
    @Value("${gridseries.ingestion.worker-count:0}")
    private int ingestionWorkerCount;

    @Value("${gridseries.ingestion.chunk-size:10000}")
    private int ingestionChunkSize;

    @Value("${gridseries.ingestion.max-chunk-size:100000}")
    private int ingestionMaxChunkSize;

    // requested source paths must resolve inside this folder
    @Value("${gridseries.ingestion.source-dir:data}")
    private String ingestionSourceDir;

    @Value("${gridseries.ingestion.skip-threshold:0.01}")
    private double ingestionSkipThreshold;

    @Value("${gridseries.ingestion.mode:REPLACE}")
    private IngestionMode ingestionMode;

    @Value("${gridseries.ingestion.timestamp-format:AUTO}")
    private CsvTimestampFormat ingestionTimestampFormat;

    @Value("${gridseries.ingestion.source-zone:UTC}")
    private String ingestionSourceZone;

    @Value("${gridseries.ingestion.progress-interval-rows:100000}")
    private long ingestionProgressIntervalRows;

    @Value("${gridseries.store.create-hypertable:true}")
    private boolean storeCreateHypertable;

    @Value("${gridseries.datasets:swissgrid_frequency_data:30s}")
    private String datasets;

    @Value("${gridseries.query.default-resolution:15m}")
    private String queryDefaultResolution;

    public int resolveWorkerCount(Integer requested) {
        if (requested != null) {
            return requested;
        }
        return ingestionWorkerCount > 0 ? ingestionWorkerCount : Runtime.getRuntime().availableProcessors();
    }
}
