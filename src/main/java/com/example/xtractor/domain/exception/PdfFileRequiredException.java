package com.example.xtractor.domain.exception;

/**
 * Raised when an upload request arrives without a boundary PDF or with an empty one.
 */
public class PdfFileRequiredException extends DomainException {

    public PdfFileRequiredException() {
        super("Please choose a boundary PDF to upload.");
    }
}
