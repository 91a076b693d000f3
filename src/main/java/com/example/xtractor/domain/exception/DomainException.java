package com.example.xtractor.domain.exception;

/**
 * Base type for request-level rule violations detected before any PDF is parsed.
 * Subclasses never wrap infrastructure failures.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message explanation shown to the caller
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * @param message explanation shown to the caller
	 * @param cause   original exception
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
