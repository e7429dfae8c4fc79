package com.example.waterrights.application.exception;

/**
 * Signals an invalid parse request, e.g. a water right number that is not positive.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
