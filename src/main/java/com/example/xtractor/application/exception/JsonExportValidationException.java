package com.example.xtractor.application.exception;

/**
 * Thrown when a JSON export or import request cannot be served, for example because there is no
 * document to write or the payload to parse is blank.
 */
public class JsonExportValidationException extends UseCaseValidationException {

    public JsonExportValidationException(String message) {
        super(message);
    }
}
