package com.example.xtractor.application.extraction;

import com.example.xtractor.application.exception.ExtractionCancelledException;
import com.example.xtractor.domain.model.BoundaryDocument;
import com.example.xtractor.domain.model.ExtractionStatistics;
import com.example.xtractor.domain.model.PageContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Rebuilds the State / LGA / Ward hierarchy from a page sequence.
 * <p>
 * Pages must arrive in document order: the current State and LGA depend on everything seen before.
 * The engine keeps no state between calls, so one instance can serve concurrent extractions of
 * independent documents.
 */
public class HierarchyExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(HierarchyExtractionEngine.class);

    private final ExtractionSettings settings;
    private final PageProcessor pageProcessor;

    public HierarchyExtractionEngine(ExtractionSettings settings) {
        this.settings = settings;
        this.pageProcessor = new PageProcessor(new RowClassifier(settings), settings);
    }

    public ExtractionSettings settings() {
        return settings;
    }

    /**
     * Runs a full extraction.
     *
     * @param pages page content in document order
     * @return document and statistics; malformed input yields lower counts, never an exception
     */
    public ExtractionOutcome extract(Iterable<PageContent> pages) {
        return extract(pages, () -> false);
    }

    /**
     * Runs a full extraction that the caller may abandon between pages.
     *
     * @param pages     page content in document order
     * @param cancelled checked before every page
     * @return document and statistics
     * @throws ExtractionCancelledException when {@code cancelled} reports {@code true}
     */
    public ExtractionOutcome extract(Iterable<PageContent> pages, BooleanSupplier cancelled) {
        ExtractionContext context = new ExtractionContext();
        DocumentBuilder builder = new DocumentBuilder(context, settings.maxCodeLength());
        pageProcessor.start(context, builder);

        int processed = 0;
        for (PageContent page : pages) {
            if (cancelled.getAsBoolean()) {
                log.info("Extraction cancelled after {} page(s)", processed);
                throw new ExtractionCancelledException(page.pageNumber());
            }
            pageProcessor.process(page, context, builder);
            processed++;
        }

        BoundaryDocument document = builder.document();
        ExtractionStatistics statistics = ExtractionStatistics.of(document);
        log.info("Extraction complete: {} page(s), {} state(s), {} LGA(s), {} ward(s)",
                processed, statistics.totalStates(), statistics.totalLgas(), statistics.totalWards());
        return new ExtractionOutcome(document, statistics);
    }
}
