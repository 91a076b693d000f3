package com.example.xtractor.application.extraction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stateless decision table that labels table rows and text lines.
 * It never looks at extraction context; ambiguous rows are flagged and resolved by the {@link PageProcessor}.
 */
public class RowClassifier {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CODE_CHARS = Pattern.compile("[A-Z0-9]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern ANY_DIGIT = Pattern.compile(".*\\d.*");
    private static final String STATE_SUFFIX = " STATE";

    private final ExtractionSettings settings;
    private final Set<String> referenceStates;

    public RowClassifier(ExtractionSettings settings) {
        this.settings = settings;
        this.referenceStates = new HashSet<>(settings.referenceStates());
    }

    /**
     * Classifies one table row.
     *
     * @param row raw cells, possibly containing {@code null} or blank entries
     * @return classification, never {@code null}
     */
    public RowClassification classifyRow(List<String> row) {
        if (row == null || row.isEmpty()) {
            return RowClassification.noise();
        }
        List<String> cells = new ArrayList<>(row.size());
        int firstFilled = -1;
        for (int i = 0; i < row.size(); i++) {
            String cell = normalize(row.get(i));
            if (cell.isEmpty()) {
                continue;
            }
            if (firstFilled < 0) {
                firstFilled = i;
            }
            cells.add(cell);
        }
        if (cells.size() < 2) {
            return RowClassification.noise();
        }
        if (isTableHeader(String.join(" ", cells))) {
            return RowClassification.header();
        }

        String first = cells.get(0);
        String second = cells.get(1);
        String last = cells.get(cells.size() - 1);

        if (!isPlausibleCode(first) && isPlausibleCode(second)) {
            if (cells.size() >= 3 && isPlausibleCode(cells.get(2))) {
                // a bare code is not a ward name
                return RowClassification.lga(first, second);
            }
            if (cells.size() >= 4 && isPlausibleCode(last)) {
                return RowClassification.lgaWithWard(first, second, cells.get(2), last);
            }
            if (cells.size() >= 3) {
                return RowClassification.lgaWithWard(first, second, cells.get(2), null);
            }
            if (cells.size() == 2) {
                if (firstFilled > 0) {
                    // indented into the ward columns
                    return RowClassification.ward(first, second);
                }
                if (row.size() > 2) {
                    return RowClassification.lga(first, second);
                }
                return RowClassification.ambiguous(first, second);
            }
        }

        if (cells.size() >= 3 && isPlausibleCode(last)) {
            for (String cell : cells.subList(0, cells.size() - 1)) {
                if (!isPlausibleCode(cell)) {
                    return RowClassification.ward(cell, last);
                }
            }
        }
        return RowClassification.noise();
    }

    /**
     * Classifies one line of free page text. Only banners are of interest; everything else is noise.
     *
     * @param line raw text line
     * @return {@link RowCategory#REGION_BANNER} with the State name, or noise
     */
    public RowClassification classifyLine(String line) {
        String normalized = normalize(line);
        if (normalized.isEmpty()) {
            return RowClassification.noise();
        }
        String reference = matchReferenceState(normalized);
        if (reference != null) {
            return RowClassification.banner(reference);
        }
        if (looksLikeBanner(line.trim())) {
            return RowClassification.banner(stripStateSuffix(normalized));
        }
        return RowClassification.noise();
    }

    /**
     * @param text row text joined with spaces
     * @return {@code true} when the text contains enough distinct column-label keywords
     */
    public boolean isTableHeader(String text) {
        if (text == null) {
            return false;
        }
        String upper = normalize(text);
        int matches = 0;
        for (String keyword : settings.headerKeywords()) {
            if (upper.contains(keyword)) {
                matches++;
                if (matches >= settings.headerMinMatches()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * A plausible code is a short token that is numeric, or alphanumeric with at least one digit.
     *
     * @param token candidate cell value
     * @return {@code true} when the token may be an LGA or ward code
     */
    public boolean isPlausibleCode(String token) {
        String value = normalize(token);
        if (value.isEmpty() || value.length() > settings.maxCodeLength()) {
            return false;
        }
        return CODE_CHARS.matcher(value).matches() && ANY_DIGIT.matcher(value).matches();
    }

    /**
     * @param code normalized code
     * @return {@code true} when the code is made of digits only
     */
    public static boolean isNumericCode(String code) {
        return code != null && DIGITS.matcher(code).matches();
    }

    /**
     * Trims, collapses inner whitespace and upper-cases a value.
     *
     * @param value raw value
     * @return normalized value, empty for {@code null}
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.strip()).replaceAll(" ").toUpperCase(Locale.ROOT);
    }

    private String matchReferenceState(String normalized) {
        if (referenceStates.contains(normalized)) {
            return normalized;
        }
        String stripped = stripStateSuffix(normalized);
        return referenceStates.contains(stripped) ? stripped : null;
    }

    private boolean looksLikeBanner(String line) {
        int length = line.length();
        if (length < settings.bannerMinLength() || length > settings.bannerMaxLength()) {
            return false;
        }
        if (ANY_DIGIT.matcher(line).matches()) {
            return false;
        }
        int nonSpace = 0;
        int upper = 0;
        int alphaOrSpace = 0;
        for (int i = 0; i < length; i++) {
            char c = line.charAt(i);
            if (Character.isLetter(c) || Character.isWhitespace(c)) {
                alphaOrSpace++;
            }
            if (!Character.isWhitespace(c)) {
                nonSpace++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        if (nonSpace == 0) {
            return false;
        }
        if ((double) upper / nonSpace < settings.bannerUpperRatio()) {
            return false;
        }
        if ((double) alphaOrSpace / length < settings.bannerAlphaRatio()) {
            return false;
        }
        String upperLine = normalize(line);
        for (String keyword : settings.bannerRejectKeywords()) {
            if (upperLine.contains(keyword)) {
                return false;
            }
        }
        return !isTableHeader(upperLine);
    }

    private static String stripStateSuffix(String normalized) {
        if (normalized.endsWith(STATE_SUFFIX) && normalized.length() > STATE_SUFFIX.length()) {
            return normalized.substring(0, normalized.length() - STATE_SUFFIX.length()).strip();
        }
        return normalized;
    }
}
