package com.example.xtractor.application.exception;

/**
 * Base unchecked exception for use-case failures in the application layer.
 * Carries no transport or persistence details.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 * @param cause   underlying exception coming from deeper layers
	 */
    protected ApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
