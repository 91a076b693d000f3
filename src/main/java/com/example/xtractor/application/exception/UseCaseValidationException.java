package com.example.xtractor.application.exception;

/**
 * Signals invalid input to an application use case.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
