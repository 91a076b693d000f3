package com.example.xtractor.domain.exception;

/**
 * Raised when a path-based extraction points at a file that does not exist.
 */
public class PdfNotFoundException extends DomainException {

	/**
	 * @param path path that could not be resolved
	 */
    public PdfNotFoundException(String path) {
        super("PDF not found: " + path);
    }
}
