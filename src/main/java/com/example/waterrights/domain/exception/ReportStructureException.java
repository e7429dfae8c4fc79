package com.example.waterrights.domain.exception;

/**
 * Raised when a section sentinel is missing or out of place.
 */
public class ReportStructureException extends ReportFormatException {

	/**
	 * @param expectedKey sentinel key that should have appeared
	 * @param actualKey   key found instead
	 */
    public ReportStructureException(String expectedKey, String actualKey) {
        super("Expected key '" + expectedKey + "' but found '" + actualKey + "'.");
    }
}
