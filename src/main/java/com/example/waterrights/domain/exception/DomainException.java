package com.example.waterrights.domain.exception;

/**
 * Base type for all domain-level exceptions.
 * Subclasses describe why a report or an upload cannot be turned into a water right.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of what the report or request got wrong
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of what the report or request got wrong
	 * @param cause   original exception, e.g. a number that failed to parse
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
