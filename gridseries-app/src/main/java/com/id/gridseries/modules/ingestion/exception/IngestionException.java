package com.id.gridseries.modules.ingestion.exception;

import com.id.gridseries.modules.ingestion.model.enums.IngestionStage;
import lombok.Getter;

/**
 * Base of the failures that terminate an ingestion job.
 */
@Getter
public abstract class IngestionException extends RuntimeException {

    private final IngestionStage stage;

    protected IngestionException(IngestionStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected IngestionException(IngestionStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
