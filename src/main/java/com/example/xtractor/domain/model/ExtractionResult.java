package com.example.xtractor.domain.model;

/**
 * Domain DTO returned to controllers after a PDF has been read and run through the extraction engine.
 */
public record ExtractionResult(
        String fileName,
        int pageCount,
        BoundaryDocument document,
        ExtractionStatistics statistics
) {
}
