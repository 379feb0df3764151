package com.id.gridseries.modules.query.exception;

import lombok.Getter;

@Getter
public class DatasetNotFoundException extends RuntimeException {

    private final String datasetName;

    public DatasetNotFoundException(String datasetName) {
        super("Dataset not found: " + datasetName);
        this.datasetName = datasetName;
    }

    public DatasetNotFoundException(String datasetName, Throwable cause) {
        super("Dataset not found: " + datasetName, cause);
        this.datasetName = datasetName;
    }
}
