package com.id.gridseries.modules.query.service;

import com.id.gridseries.config.AppConfig;
import com.id.gridseries.model.TimeSeriesPoint;
import com.id.gridseries.modules.datasets.model.DatasetDefinition;
import com.id.gridseries.modules.datasets.service.DatasetRegistry;
import com.id.gridseries.modules.query.model.Resolution;
import com.id.gridseries.modules.query.model.TimeRange;
import com.id.gridseries.modules.store.SampleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side. Aggregation always averages the samples of each bucket.
 */
@Service
@Slf4j
public class TimeSeriesQueryService {

    private final DatasetRegistry datasetRegistry;
    private final SampleStore sampleStore;
    private final AppConfig appConfig;

    public TimeSeriesQueryService(DatasetRegistry datasetRegistry, SampleStore sampleStore, AppConfig appConfig) {
        this.datasetRegistry = datasetRegistry;
        this.sampleStore = sampleStore;
        this.appConfig = appConfig;
    }

    public List<TimeSeriesPoint> aggregated(String datasetName, String startTime, String endTime, String resolution) {
        DatasetDefinition dataset = datasetRegistry.require(datasetName);
        TimeRange range = TimeRange.parse(startTime, endTime);
        Resolution requested = Resolution.parse(resolution == null || resolution.isBlank()
                ? appConfig.getQueryDefaultResolution()
                : resolution);

        // no upsampling below the recorded cadence
        Resolution effective = requested.atLeast(dataset.nativeResolution());
        log.debug("Aggregating '{}' over [{}, {}] at {} (requested {})",
                dataset.name(), range.start(), range.end(), effective, requested);

        return sampleStore.aggregate(dataset.name(), range.start(), range.end(), effective.step());
    }

    public List<TimeSeriesPoint> raw(String datasetName, String startTime, String endTime) {
        DatasetDefinition dataset = datasetRegistry.require(datasetName);
        TimeRange range = TimeRange.parse(startTime, endTime);
        return sampleStore.fetch(dataset.name(), range.start(), range.end());
    }
}
