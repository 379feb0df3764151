package com.id.gridseries.modules.store;

import com.id.gridseries.model.TimeSeriesPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Time-ordered storage of datasets: bulk writes through a session, ranged reads per call.
 */
public interface SampleStore {

    /**
     * Opens a write session bound to one dataset. The caller owns it and must close it.
     */
    SampleStoreSession openSession(String datasetName);

    /**
     * Averages of the samples in {@code [start, end]} per bucket of {@code step}, ordered by bucket start.
     *
     * @throws com.id.gridseries.modules.query.exception.DatasetNotFoundException if the dataset has no table
     */
    List<TimeSeriesPoint> aggregate(String datasetName, Instant start, Instant end, Duration step);

    /**
     * The stored samples in {@code [start, end]}, ordered by timestamp.
     *
     * @throws com.id.gridseries.modules.query.exception.DatasetNotFoundException if the dataset has no table
     */
    List<TimeSeriesPoint> fetch(String datasetName, Instant start, Instant end);
}
