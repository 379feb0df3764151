package com.id.gridseries.modules.ingestion.exception;

import com.id.gridseries.modules.ingestion.model.enums.IngestionStage;

import java.sql.SQLException;

public class LoadFailedException extends IngestionException {

    public LoadFailedException(String message) {
        super(IngestionStage.LOAD, message);
    }

    public LoadFailedException(String message, SQLException cause) {
        super(IngestionStage.LOAD, "%s [SQLState %s]: %s".formatted(message, cause.getSQLState(), cause.getMessage()), cause);
    }
}
