package com.example.xtractor.domain.exception;

/**
 * Raised when a path-based extraction is requested with a {@code null} path.
 */
public class PdfPathRequiredException extends DomainException {

    public PdfPathRequiredException() {
        super("PDF path is required.");
    }
}
