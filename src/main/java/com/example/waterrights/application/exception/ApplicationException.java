package com.example.waterrights.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Parsing services throw subclasses of this type for invalid requests without coupling to the transport.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
