package com.example.xtractor.application.extraction;

/**
 * Classifier verdict plus the normalized fields needed to act on it.
 * Unused fields are {@code null}. An {@link RowCategory#LGA_RECORD} may also carry the first ward
 * printed on the same row.
 *
 * @param category   row category
 * @param lgaName    LGA name for LGA records
 * @param lgaCode    LGA code for LGA records
 * @param wardName   ward name for ward records, or the ward sharing an LGA row
 * @param wardCode   ward code, {@code null} when the row printed none
 * @param bannerName State name for banners
 * @param ambiguous  {@code true} for bare name+code rows that may be either an LGA or a ward
 */
public record RowClassification(
        RowCategory category,
        String lgaName,
        String lgaCode,
        String wardName,
        String wardCode,
        String bannerName,
        boolean ambiguous
) {

    private static final RowClassification NOISE =
            new RowClassification(RowCategory.NOISE, null, null, null, null, null, false);
    private static final RowClassification HEADER =
            new RowClassification(RowCategory.TABLE_HEADER, null, null, null, null, null, false);

    public static RowClassification noise() {
        return NOISE;
    }

    public static RowClassification header() {
        return HEADER;
    }

    public static RowClassification banner(String stateName) {
        return new RowClassification(RowCategory.REGION_BANNER, null, null, null, null, stateName, false);
    }

    public static RowClassification lga(String name, String code) {
        return new RowClassification(RowCategory.LGA_RECORD, name, code, null, null, null, false);
    }

    public static RowClassification lgaWithWard(String name, String code, String wardName, String wardCode) {
        return new RowClassification(RowCategory.LGA_RECORD, name, code, wardName, wardCode, null, false);
    }

    public static RowClassification ambiguous(String name, String code) {
        return new RowClassification(RowCategory.LGA_RECORD, name, code, null, null, null, true);
    }

    public static RowClassification ward(String name, String code) {
        return new RowClassification(RowCategory.WARD_RECORD, null, null, name, code, null, false);
    }

    /**
     * @return {@code true} when an LGA row also names a ward
     */
    public boolean carriesWard() {
        return category == RowCategory.LGA_RECORD && wardName != null;
    }
}
