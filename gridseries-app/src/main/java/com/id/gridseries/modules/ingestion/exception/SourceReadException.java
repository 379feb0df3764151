package com.id.gridseries.modules.ingestion.exception;

import com.id.gridseries.modules.ingestion.model.enums.IngestionStage;

import java.io.IOException;
import java.nio.file.Path;

public class SourceReadException extends IngestionException {

    public SourceReadException(Path path, IOException cause) {
        super(IngestionStage.READ, "Failed reading %s: %s".formatted(path, cause.getMessage()), cause);
    }
}
