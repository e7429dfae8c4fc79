package com.example.waterrights.domain.exception;

/**
 * Raised for a field key or allowance kind outside the known report vocabulary.
 */
public class UnknownFieldException extends ReportFormatException {

	/**
	 * @param section report section the key appeared in
	 * @param key     unrecognized key
	 */
    public UnknownFieldException(String section, String key) {
        super("Unknown " + section + " key: '" + key + "'.");
    }
}
