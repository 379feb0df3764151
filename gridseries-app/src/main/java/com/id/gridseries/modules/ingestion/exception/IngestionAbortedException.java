package com.id.gridseries.modules.ingestion.exception;

import com.id.gridseries.modules.ingestion.model.enums.IngestionStage;

public class IngestionAbortedException extends IngestionException {

    public IngestionAbortedException(String message) {
        super(IngestionStage.TRANSFORM, message);
    }

    public IngestionAbortedException(String message, Throwable cause) {
        super(IngestionStage.TRANSFORM, message, cause);
    }
}
