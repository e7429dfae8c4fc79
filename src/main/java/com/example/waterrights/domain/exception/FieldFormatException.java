package com.example.waterrights.domain.exception;

/**
 * Raised when a known field carries the wrong number of values or text that breaks its fixed grammar.
 */
public class FieldFormatException extends ReportFormatException {

    public FieldFormatException(String key, String detail) {
        super("Invalid value for '" + key + "': " + detail);
    }

    public FieldFormatException(String key, String detail, Throwable cause) {
        super("Invalid value for '" + key + "': " + detail, cause);
    }
}
