package com.id.gridseries.modules.ingestion.exception;

import lombok.Getter;

/**
 * A single line could not be turned into a sample. Recoverable: the line is counted and skipped.
 */
@Getter
public class LineParseException extends Exception {

    private final long lineNumber;
    private final String field;

    public LineParseException(long lineNumber, String field, String message) {
        super("Line %d, field '%s': %s".formatted(lineNumber, field, message));
        this.lineNumber = lineNumber;
        this.field = field;
    }
}
