package com.example.xtractor.application.extraction;

import com.example.xtractor.domain.model.BoundaryDocument;
import com.example.xtractor.domain.model.ExtractionStatistics;

/**
 * Document and statistics produced by one call to {@link HierarchyExtractionEngine#extract}.
 */
public record ExtractionOutcome(
        BoundaryDocument document,
        ExtractionStatistics statistics
) {
}
