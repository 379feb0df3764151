package com.id.gridseries.modules.ingestion.progress;

/**
 * Observer of transformer progress. Called from the draining thread only, once per chunk, in chunk order.
 */
@FunctionalInterface
public interface IngestionProgressListener {

    IngestionProgressListener NONE = progress -> {
    };

    void onProgress(IngestionProgress progress);
}
