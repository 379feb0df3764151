package com.id.gridseries.modules.ingestion.model.enums;

public enum IngestionStage {
    READ,
    TRANSFORM,
    LOAD
}
