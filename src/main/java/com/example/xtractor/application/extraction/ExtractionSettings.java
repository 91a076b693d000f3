package com.example.xtractor.application.extraction;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable tuning knobs for one extraction engine. Keyword lists and reference names are
 * upper-cased on construction so the classifier can compare them directly against normalized text.
 *
 * @param referenceStates        ordered State names; enables pre-seeding and the code-reset heuristic
 * @param preSeedFirstState      whether a run starts on the first reference State
 * @param acceptUnlistedBanners  whether banners that are not reference names may open a new State
 * @param headerKeywords         column-label keywords identifying table header rows
 * @param headerMinMatches       distinct header keywords a row needs to count as a header
 * @param bannerRejectKeywords   words that disqualify a text line from being a State banner
 * @param bannerMinLength        shortest accepted banner line
 * @param bannerMaxLength        longest accepted banner line
 * @param bannerUpperRatio       minimum share of upper-case letters among non-space characters
 * @param bannerAlphaRatio       minimum share of letters and spaces in the whole line
 * @param maxCodeLength          longest token accepted as an LGA or ward code
 */
public record ExtractionSettings(
        List<String> referenceStates,
        boolean preSeedFirstState,
        boolean acceptUnlistedBanners,
        Set<String> headerKeywords,
        int headerMinMatches,
        Set<String> bannerRejectKeywords,
        int bannerMinLength,
        int bannerMaxLength,
        double bannerUpperRatio,
        double bannerAlphaRatio,
        int maxCodeLength
) {

    /**
     * The 36 Nigerian states plus FCT in alphabetical order, which is the order INEC
     * registration-area listings use.
     */
    public static final List<String> NIGERIAN_STATES = List.of(
            "ABIA", "ADAMAWA", "AKWA IBOM", "ANAMBRA", "BAUCHI", "BAYELSA",
            "BENUE", "BORNO", "CROSS RIVER", "DELTA", "EBONYI", "EDO",
            "EKITI", "ENUGU", "FCT", "GOMBE", "IMO", "JIGAWA",
            "KADUNA", "KANO", "KATSINA", "KEBBI", "KOGI", "KWARA",
            "LAGOS", "NASARAWA", "NIGER", "OGUN", "ONDO", "OSUN",
            "OYO", "PLATEAU", "RIVERS", "SOKOTO", "TARABA", "YOBE",
            "ZAMFARA"
    );

    public static final Set<String> DEFAULT_HEADER_KEYWORDS = Set.of(
            "LGA NAME", "LGA CODE", "WARD NAME", "WARD CODE", "S/N"
    );

    public static final Set<String> DEFAULT_BANNER_REJECT_KEYWORDS = Set.of(
            "PAGE", "TABLE", "TOTAL", "LIST OF", "SUMMARY", "CONTINUED",
            "REGISTRATION AREA", "POLLING UNIT", "COMMISSION", "DIRECTORY"
    );

    public ExtractionSettings {
        referenceStates = referenceStates == null ? List.of() : referenceStates.stream()
                .map(RowClassifier::normalize)
                .filter(name -> !name.isEmpty())
                .distinct()
                .toList();
        headerKeywords = upperCaseSet(headerKeywords);
        bannerRejectKeywords = upperCaseSet(bannerRejectKeywords);
        if (headerMinMatches < 1) {
            throw new IllegalArgumentException("headerMinMatches must be at least 1");
        }
        if (bannerMinLength < 1 || bannerMaxLength < bannerMinLength) {
            throw new IllegalArgumentException("Invalid banner length bounds: "
                    + bannerMinLength + ".." + bannerMaxLength);
        }
        if (maxCodeLength < 1) {
            throw new IllegalArgumentException("maxCodeLength must be at least 1");
        }
    }

    /**
     * @return settings tuned for INEC State / LGA / Ward listings
     */
    public static ExtractionSettings defaults() {
        return new ExtractionSettings(
                NIGERIAN_STATES,
                true,
                true,
                DEFAULT_HEADER_KEYWORDS,
                2,
                DEFAULT_BANNER_REJECT_KEYWORDS,
                3,
                40,
                0.8,
                0.7,
                5
        );
    }

    /**
     * @param states replacement reference ordering, may be empty to disable the code-reset heuristic
     * @return copy of these settings with a different reference ordering
     */
    public ExtractionSettings withReferenceStates(List<String> states) {
        return new ExtractionSettings(states, preSeedFirstState, acceptUnlistedBanners, headerKeywords,
                headerMinMatches, bannerRejectKeywords, bannerMinLength, bannerMaxLength,
                bannerUpperRatio, bannerAlphaRatio, maxCodeLength);
    }

    public ExtractionSettings withPreSeedFirstState(boolean preSeed) {
        return new ExtractionSettings(referenceStates, preSeed, acceptUnlistedBanners, headerKeywords,
                headerMinMatches, bannerRejectKeywords, bannerMinLength, bannerMaxLength,
                bannerUpperRatio, bannerAlphaRatio, maxCodeLength);
    }

    public boolean hasReferenceStates() {
        return !referenceStates.isEmpty();
    }

    private static Set<String> upperCaseSet(Set<String> values) {
        Set<String> normalized = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    normalized.add(value.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        return Set.copyOf(normalized);
    }
}
