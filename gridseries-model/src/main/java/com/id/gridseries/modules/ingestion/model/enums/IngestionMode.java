package com.id.gridseries.modules.ingestion.model.enums;

public enum IngestionMode {
    /**
     * Truncate the dataset before loading.
     */
    REPLACE,
    /**
     * Keep existing rows and add the new ones.
     */
    APPEND
}
