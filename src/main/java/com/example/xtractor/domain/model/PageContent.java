package com.example.xtractor.domain.model;

import java.util.List;

/**
 * Already materialized content of a single page: its tables and its full text.
 *
 * @param pageNumber one-based page number, used for logging only
 * @param tables     tables found on the page, in reading order
 * @param text       full page text with lines separated by {@code \n}
 */
public record PageContent(
        int pageNumber,
        List<ExtractedTable> tables,
        String text
) {

    public PageContent {
        tables = tables == null ? List.of() : tables;
        text = text == null ? "" : text;
    }
}
