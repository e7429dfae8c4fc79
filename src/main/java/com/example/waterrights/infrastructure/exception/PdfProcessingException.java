package com.example.waterrights.infrastructure.exception;

/**
 * Signals that PDFBox could not load a report or parse one of its content streams.
 */
public class PdfProcessingException extends InfrastructureException {
	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
