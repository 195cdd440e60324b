package com.finreview.anomaly.exception;

/**
 * A malformed analysis request, answered with HTTP 400 naming the offending field.
 */
public class InvalidRequestException extends IllegalArgumentException {

    private final String field;

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() { return field; }
}
