package com.example.xtractor.application.extraction;

import com.example.xtractor.domain.model.ExtractedTable;
import com.example.xtractor.domain.model.LgaNode;
import com.example.xtractor.domain.model.PageContent;
import com.example.xtractor.domain.model.StateNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;

/**
 * Drives a single page through the classifier and applies the verdicts to the context and the builder.
 * Tables are processed first; page text afterwards, and only for State banners.
 */
public class PageProcessor {

    private static final Logger log = LoggerFactory.getLogger(PageProcessor.class);

    private final RowClassifier classifier;
    private final ExtractionSettings settings;

    public PageProcessor(RowClassifier classifier, ExtractionSettings settings) {
        this.classifier = classifier;
        this.settings = settings;
    }

    /**
     * Puts a fresh context into its initial state: on the first reference State when pre-seeding is
     * enabled, otherwise with no State.
     *
     * @param context fresh context
     * @param builder builder of the same run
     */
    public void start(ExtractionContext context, DocumentBuilder builder) {
        if (settings.preSeedFirstState() && settings.hasReferenceStates()) {
            enterReferenceState(0, context, builder);
        }
    }

    /**
     * Processes every table row and then every text line of a page.
     *
     * @param page    page content
     * @param context context of the run
     * @param builder builder of the run
     */
    public void process(PageContent page, ExtractionContext context, DocumentBuilder builder) {
        for (ExtractedTable table : page.tables()) {
            for (List<String> row : table.rows()) {
                processRow(page.pageNumber(), row, context, builder);
            }
        }
        page.text().lines().forEach(line -> processLine(page.pageNumber(), line, context, builder));
    }

    void processRow(int pageNumber, List<String> row, ExtractionContext context, DocumentBuilder builder) {
        RowClassification classification = classifier.classifyRow(row);
        switch (classification.category()) {
            case LGA_RECORD -> applyLgaRecord(pageNumber, classification, context, builder);
            case WARD_RECORD -> applyWard(pageNumber, classification.wardName(), classification.wardCode(),
                    context, builder);
            case TABLE_HEADER -> log.debug("Page {}: skipped header row {}", pageNumber, row);
            default -> log.debug("Page {}: dropped row {}", pageNumber, row);
        }
    }

    void processLine(int pageNumber, String line, ExtractionContext context, DocumentBuilder builder) {
        RowClassification classification = classifier.classifyLine(line);
        if (classification.category() == RowCategory.REGION_BANNER) {
            applyBanner(pageNumber, classification.bannerName(), context, builder);
        }
    }

    private void applyBanner(int pageNumber, String stateName, ExtractionContext context, DocumentBuilder builder) {
        StateNode current = context.currentState();
        if (current != null && current.name().equals(stateName)) {
            return;
        }
        int referenceIndex = settings.referenceStates().indexOf(stateName);
        if (referenceIndex < 0 && !settings.acceptUnlistedBanners()) {
            log.debug("Page {}: ignored unlisted banner {}", pageNumber, stateName);
            return;
        }
        StateNode state = builder.findOrCreateState(stateName);
        context.enterState(state, referenceIndex, true);
        log.info("Page {}: banner switched state to {}", pageNumber, stateName);
    }

    private void applyLgaRecord(int pageNumber, RowClassification record, ExtractionContext context,
                                DocumentBuilder builder) {
        if (record.ambiguous() && context.currentLga() != null) {
            applyWard(pageNumber, record.lgaName(), record.lgaCode(), context, builder);
            return;
        }
        if (context.currentState() == null && !context.isExhausted() && context.referenceIndex() < 0
                && settings.hasReferenceStates()) {
            enterReferenceState(0, context, builder);
        }

        String code = record.lgaCode();
        if (RowClassifier.isNumericCode(code)) {
            BigInteger numeric = new BigInteger(code);
            BigInteger previous = context.lastLgaCode();
            if (previous != null && numeric.compareTo(previous) < 0) {
                advanceOnCodeReset(pageNumber, numeric, previous, context, builder);
            }
            if (context.currentState() != null) {
                context.recordLgaCode(numeric);
            }
        }

        StateNode state = context.currentState();
        if (state == null) {
            warnOrphan(pageNumber, "LGA", record.lgaName(), context);
            return;
        }
        LgaNode lga = builder.findOrCreateLga(state, record.lgaName(), code);
        if (record.carriesWard()) {
            builder.findOrCreateWard(lga, record.wardName(), record.wardCode());
        }
    }

    private void advanceOnCodeReset(int pageNumber, BigInteger code, BigInteger previous, ExtractionContext context,
                                    DocumentBuilder builder) {
        if (context.isBannerSourced() || !settings.hasReferenceStates() || context.referenceIndex() < 0) {
            log.debug("Page {}: LGA code {} after {} ignored for state detection", pageNumber, code, previous);
            return;
        }
        int next = context.referenceIndex() + 1;
        if (next >= settings.referenceStates().size()) {
            log.warn("Page {}: LGA code reset ({} after {}) past the last reference state; "
                    + "dropping records until a banner names a state", pageNumber, code, previous);
            context.exhaust();
            return;
        }
        enterReferenceState(next, context, builder);
        log.info("Page {}: LGA code reset ({} after {}), moving to {}",
                pageNumber, code, previous, context.currentState().name());
    }

    private void applyWard(int pageNumber, String name, String code, ExtractionContext context,
                           DocumentBuilder builder) {
        LgaNode lga = context.currentLga();
        if (lga == null) {
            warnOrphan(pageNumber, "ward", name, context);
            return;
        }
        builder.findOrCreateWard(lga, name, code);
    }

    private void enterReferenceState(int index, ExtractionContext context, DocumentBuilder builder) {
        StateNode state = builder.findOrCreateState(settings.referenceStates().get(index));
        context.enterState(state, index, false);
    }

    private void warnOrphan(int pageNumber, String level, String name, ExtractionContext context) {
        if (context.isExhausted()) {
            log.debug("Page {}: dropped {} {} after the reference states ran out", pageNumber, level, name);
        } else {
            log.warn("Page {}: dropped {} {} with no parent in scope", pageNumber, level, name);
        }
    }
}
