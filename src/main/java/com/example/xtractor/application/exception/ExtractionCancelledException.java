package com.example.xtractor.application.exception;

/**
 * Thrown by the extraction engine when the caller abandons a run between two pages.
 * The partially built document is discarded.
 */
public class ExtractionCancelledException extends ApplicationException {

	/**
	 * @param pageNumber one-based number of the first page that was not processed
	 */
    public ExtractionCancelledException(int pageNumber) {
        super("Extraction cancelled before page " + pageNumber + ".");
    }
}
