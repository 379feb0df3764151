package com.id.gridseries.modules.store;

import com.id.gridseries.model.Sample;

import java.util.List;

/**
 * One store connection running one transaction. Nothing written through the session is visible
 * before {@link #commit()}; {@link #close()} rolls back an uncommitted session and releases the connection.
 * <p>
 * Failures are reported as {@link com.id.gridseries.modules.ingestion.exception.LoadFailedException}.
 */
public interface SampleStoreSession extends AutoCloseable {

    String getDatasetName();

    /**
     * Creates the dataset table and its time partitioning when missing. No-op otherwise.
     */
    void ensureSchema();

    void truncate();

    /**
     * Streams a batch into the bulk load of this session, opening it on the first call.
     */
    void append(List<Sample> batch);

    /**
     * Completes the bulk load.
     *
     * @return rows accepted by the store
     */
    long endLoad();

    void commit();

    @Override
    void close();
}
