package com.example.xtractor.infrastructure.exception;

/**
 * Raised when PDFBox cannot open or read a boundary document. This is the only failure that aborts
 * an extraction as a whole.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
