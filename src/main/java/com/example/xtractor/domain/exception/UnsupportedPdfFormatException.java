package com.example.xtractor.domain.exception;

/**
 * Raised when an uploaded file is neither declared as {@code application/pdf} nor named {@code *.pdf}.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF files are allowed" + (fileName != null ? ": " + fileName : "."));
    }
}
