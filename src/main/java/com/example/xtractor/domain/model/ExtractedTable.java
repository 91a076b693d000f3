package com.example.xtractor.domain.model;

import java.util.List;

/**
 * One table as handed over by the document reader: rows of cells, where a cell may be {@code null}
 * or empty when the source left it blank.
 */
public record ExtractedTable(List<List<String>> rows) {

    public ExtractedTable {
        rows = rows == null ? List.of() : rows;
    }
}
