package com.example.waterrights.domain.exception;

/**
 * Raised when an upload flow runs without a report file.
 */
public class ReportFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public ReportFileRequiredException() {
        super("Please choose a water right report PDF to upload.");
    }
}
