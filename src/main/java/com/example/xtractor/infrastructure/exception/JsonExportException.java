package com.example.xtractor.infrastructure.exception;

/**
 * Raised when Jackson cannot write or read the boundary JSON, or the export file cannot be written.
 */
public class JsonExportException extends InfrastructureException {

    public JsonExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
