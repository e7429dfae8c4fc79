package com.example.waterrights.infrastructure.exception;

/**
 * Base unchecked exception for adapter failures (PDF loading, worker pools).
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
