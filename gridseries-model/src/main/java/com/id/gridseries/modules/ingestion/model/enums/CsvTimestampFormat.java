package com.id.gridseries.modules.ingestion.model.enums;

public enum CsvTimestampFormat {
    AUTO,
    ISO_8601,
    DD_MM_YY_HH_MM_SS,
    YYYY_MM_DD_HH_MM_SS,
    EPOCH_MILLIS,
    EPOCH_SECONDS
}
