package com.example.waterrights.domain.exception;

/**
 * Base type for violations of the report layout or field vocabulary.
 * Any of these aborts parsing of the affected report only.
 */
public abstract class ReportFormatException extends DomainException {

    protected ReportFormatException(String message) {
        super(message);
    }

    protected ReportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
