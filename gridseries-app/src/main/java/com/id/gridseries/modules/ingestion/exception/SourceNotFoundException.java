package com.id.gridseries.modules.ingestion.exception;

import com.id.gridseries.modules.ingestion.model.enums.IngestionStage;

import java.nio.file.Path;

public class SourceNotFoundException extends IngestionException {

    public SourceNotFoundException(Path path) {
        super(IngestionStage.READ, "Source file not found: " + path);
    }
}
