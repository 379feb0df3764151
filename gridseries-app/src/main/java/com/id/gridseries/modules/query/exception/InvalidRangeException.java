package com.id.gridseries.modules.query.exception;

/**
 * Malformed or inverted query bounds. A caller error, reported as 400.
 */
public class InvalidRangeException extends IllegalArgumentException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
