package com.example.xtractor.infrastructure.pdf;

import com.example.xtractor.domain.model.ExtractedTable;
import com.example.xtractor.domain.model.PageContent;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Infrastructure adapter that turns PDF bytes into {@link PageContent} for the extraction engine.
 * <p>
 * PDFBox has no notion of tables, so rows are rebuilt from word positions: words are grouped into
 * lines by their Y coordinate, split into cells at wide horizontal gaps, and consecutive multi-cell
 * lines form a table. Within a table the widest line defines the column anchors so that rows with
 * missing cells keep their blank positions.
 */
@Component
public class PdfBoxPageReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageReader.class);

    /**
     * Loads a PDF and reads every page.
     *
     * @param bytes PDF bytes
     * @return page content in document order
     * @throws IOException when PDFBox cannot parse the document
     */
    public List<PageContent> read(byte[] bytes) throws IOException {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            int pageCount = document.getNumberOfPages();
            log.info("Reading {} page(s)", pageCount);
            List<PageContent> pages = new ArrayList<>(pageCount);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                pages.add(readPage(document, pageNumber));
            }
            return pages;
        }
    }

    private PageContent readPage(PDDocument document, int pageNumber) throws IOException {
        PDFTextStripper textStripper = new PDFTextStripper();
        configureStripper(textStripper, pageNumber);
        String text = textStripper.getText(document);

        PositionedWordStripper wordStripper = new PositionedWordStripper();
        configureStripper(wordStripper, pageNumber);
        wordStripper.getText(document);

        List<ExtractedTable> tables = buildTables(wordStripper.getLines());
        log.debug("Page {}: {} table(s), {} text line(s)", pageNumber, tables.size(), text.lines().count());
        return new PageContent(pageNumber, tables, text);
    }

    /**
     * Splits positioned lines into tables at every line that has fewer than two cells.
     *
     * @param lines page lines ordered top to bottom
     * @return tables with column-aligned rows
     */
    List<ExtractedTable> buildTables(List<TableLine> lines) {
        List<ExtractedTable> tables = new ArrayList<>();
        List<List<Cell>> current = new ArrayList<>();
        for (TableLine line : lines) {
            List<Cell> cells = line.cells();
            if (cells.size() < 2) {
                flushTable(current, tables);
                continue;
            }
            current.add(cells);
        }
        flushTable(current, tables);
        return tables;
    }

    private void flushTable(List<List<Cell>> rows, List<ExtractedTable> tables) {
        if (rows.isEmpty()) {
            return;
        }
        ColumnLayout layout = ColumnLayout.from(rows);
        List<List<String>> aligned = new ArrayList<>(rows.size());
        for (List<Cell> row : rows) {
            aligned.add(layout.align(row));
        }
        tables.add(new ExtractedTable(aligned));
        rows.clear();
    }

    private void configureStripper(PDFTextStripper stripper, int pageNumber) {
        stripper.setSortByPosition(true);
        stripper.setSuppressDuplicateOverlappingText(true);
        stripper.setLineSeparator("\n");
        stripper.setWordSeparator(" ");
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
    }

    /**
     * Column anchors taken from the centers of the widest row of a table.
     */
    static final class ColumnLayout {
        private final List<Float> anchors;

        private ColumnLayout(List<Float> anchors) {
            this.anchors = anchors;
        }

        static ColumnLayout from(List<List<Cell>> rows) {
            List<Cell> widest = rows.stream()
                    .max(Comparator.comparingInt(List::size))
                    .orElse(Collections.emptyList());
            return new ColumnLayout(widest.stream().map(Cell::center).toList());
        }

        /**
         * Places every cell in the column whose anchor is closest to the cell center.
         * Two cells landing in the same column are joined with a space.
         */
        List<String> align(List<Cell> row) {
            String[] values = new String[anchors.size()];
            for (Cell cell : row) {
                int column = nearestColumn(cell.center());
                values[column] = values[column] == null ? cell.text() : values[column] + " " + cell.text();
            }
            List<String> aligned = new ArrayList<>(values.length);
            for (String value : values) {
                aligned.add(value == null ? "" : value);
            }
            return aligned;
        }

        private int nearestColumn(float center) {
            int best = 0;
            float bestDistance = Float.MAX_VALUE;
            for (int i = 0; i < anchors.size(); i++) {
                float distance = Math.abs(anchors.get(i) - center);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = i;
                }
            }
            return best;
        }
    }

    /**
     * One text line with its words ordered left to right.
     */
    static final class TableLine {
        private static final float CELL_GAP = 10f;
        private final float y;
        private final List<PositionedToken> tokens = new ArrayList<>();

        TableLine(float y) {
            this.y = y;
        }

        void addToken(PositionedToken token) {
            tokens.add(token);
        }

        float y() {
            return y;
        }

        /**
         * Merges neighbouring words into cells; a horizontal gap wider than {@link #CELL_GAP} starts a new cell.
         */
        List<Cell> cells() {
            List<PositionedToken> sorted = new ArrayList<>(tokens);
            sorted.sort(Comparator.comparing(PositionedToken::x));
            List<Cell> cells = new ArrayList<>();
            List<PositionedToken> pending = new ArrayList<>();
            float previousEnd = Float.NaN;
            for (PositionedToken token : sorted) {
                if (!pending.isEmpty() && token.x() - previousEnd > CELL_GAP) {
                    cells.add(Cell.of(pending));
                    pending = new ArrayList<>();
                }
                pending.add(token);
                previousEnd = Float.isNaN(previousEnd) ? token.endX() : Math.max(previousEnd, token.endX());
            }
            if (!pending.isEmpty()) {
                cells.add(Cell.of(pending));
            }
            return cells;
        }
    }

    /**
     * Horizontal run of words that belong to the same table cell.
     */
    record Cell(float x, float endX, String text) {

        static Cell of(List<PositionedToken> tokens) {
            float start = tokens.get(0).x();
            float end = tokens.stream().map(PositionedToken::endX).max(Float::compareTo).orElse(start);
            String text = tokens.stream()
                    .map(PositionedToken::text)
                    .map(String::strip)
                    .filter(value -> !value.isEmpty())
                    .collect(Collectors.joining(" "));
            return new Cell(start, end, text);
        }

        float center() {
            return x + ((endX - x) / 2f);
        }
    }

    /**
     * Word extracted from the PDF with its horizontal extent.
     */
    record PositionedToken(float x, float endX, String text) {

        PositionedToken {
            endX = Math.max(endX, x);
            text = text == null ? "" : text;
        }
    }

    /**
     * Collects every word of a page together with its position instead of producing plain text.
     */
    private static final class PositionedWordStripper extends PDFTextStripper {
        private static final float Y_TOLERANCE = 2f;
        private final List<TableLine> lines = new ArrayList<>();

        PositionedWordStripper() throws IOException {
            super();
        }

        List<TableLine> getLines() {
            List<TableLine> sorted = new ArrayList<>(lines);
            sorted.sort(Comparator.comparing(TableLine::y));
            return sorted;
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            if (text != null && !text.isBlank() && !textPositions.isEmpty()) {
                float x = textPositions.stream()
                        .map(TextPosition::getXDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                float endX = textPositions.stream()
                        .map(position -> position.getXDirAdj() + position.getWidthDirAdj())
                        .max(Float::compareTo)
                        .orElse(x);
                float y = textPositions.stream()
                        .map(TextPosition::getYDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                resolveLine(y).addToken(new PositionedToken(x, endX, text));
            }
            super.writeString(text, textPositions);
        }

        private TableLine resolveLine(float y) {
            for (TableLine line : lines) {
                if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                    return line;
                }
            }
            TableLine line = new TableLine(y);
            lines.add(line);
            return line;
        }
    }
}
