package com.example.xtractor.application.extraction;

/**
 * Outcome of classifying a single table row or text line.
 */
public enum RowCategory {
    NOISE,
    TABLE_HEADER,
    REGION_BANNER,
    LGA_RECORD,
    WARD_RECORD
}
