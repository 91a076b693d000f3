package com.example.xtractor.application.extraction;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for each rule of the row and line decision table.
 */
class RowClassifierTest {

    private final RowClassifier classifier = new RowClassifier(ExtractionSettings.defaults());

    /**
     * Ensures rows with at most one filled cell are dropped as noise.
     */
    @Test
    void rowsWithFewerThanTwoFilledCellsAreNoise() {
        assertThat(classifier.classifyRow(Arrays.asList(null, "  ", "ABA")).category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyRow(List.of()).category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyRow(null).category()).isEqualTo(RowCategory.NOISE);
    }

    /**
     * Verifies that a header needs at least two distinct column-label keywords.
     */
    @Test
    void headerRowsNeedTwoKeywords() {
        RowClassification header = classifier.classifyRow(List.of("LGA Name", "LGA Code", "Ward Name", "", "", "Ward Code"));
        assertThat(header.category()).isEqualTo(RowCategory.TABLE_HEADER);

        assertThat(classifier.isTableHeader("S/N LGA NAME")).isTrue();
        assertThat(classifier.isTableHeader("WARD CODE")).isFalse();
    }

    /**
     * Verifies that the combined LGA + first ward row yields both records, normalized.
     */
    @Test
    void combinedRowCarriesLgaAndFirstWard() {
        RowClassification row = classifier.classifyRow(List.of("Aba  North", "01", "Eziama", "", "", "01"));

        assertThat(row.category()).isEqualTo(RowCategory.LGA_RECORD);
        assertThat(row.lgaName()).isEqualTo("ABA NORTH");
        assertThat(row.lgaCode()).isEqualTo("01");
        assertThat(row.wardName()).isEqualTo("EZIAMA");
        assertThat(row.wardCode()).isEqualTo("01");
        assertThat(row.carriesWard()).isTrue();
        assertThat(row.ambiguous()).isFalse();
    }

    /**
     * Verifies that a three-cell LGA row keeps its ward name without a code.
     */
    @Test
    void lgaRowWithUncodedWardKeepsWardName() {
        RowClassification row = classifier.classifyRow(List.of("Bende", "04", "Item"));

        assertThat(row.category()).isEqualTo(RowCategory.LGA_RECORD);
        assertThat(row.wardName()).isEqualTo("ITEM");
        assertThat(row.wardCode()).isNull();
    }

    /**
     * Verifies that a name and code sitting in the ward columns is a ward.
     */
    @Test
    void indentedNameAndCodeIsAWard() {
        RowClassification row = classifier.classifyRow(List.of("", "", "Ariaria", "", "", "02"));

        assertThat(row.category()).isEqualTo(RowCategory.WARD_RECORD);
        assertThat(row.wardName()).isEqualTo("ARIARIA");
        assertThat(row.wardCode()).isEqualTo("02");
    }

    /**
     * Verifies that a name and code in the LGA columns of a wide row is an LGA.
     */
    @Test
    void nameAndCodeInLeadingColumnsOfWideRowIsAnLga() {
        RowClassification row = classifier.classifyRow(List.of("Aba South", "02", "", "", "", ""));

        assertThat(row.category()).isEqualTo(RowCategory.LGA_RECORD);
        assertThat(row.ambiguous()).isFalse();
        assertThat(row.carriesWard()).isFalse();
    }

    /**
     * Ensures a bare two-cell name and code row is flagged ambiguous.
     */
    @Test
    void bareNameAndCodeRowIsAmbiguous() {
        RowClassification row = classifier.classifyRow(List.of("Umuahia North", "03"));

        assertThat(row.category()).isEqualTo(RowCategory.LGA_RECORD);
        assertThat(row.ambiguous()).isTrue();
        assertThat(row.lgaName()).isEqualTo("UMUAHIA NORTH");
    }

    /**
     * Verifies that a serial-numbered row with a trailing code is a ward.
     */
    @Test
    void serialNumberedRowWithTrailingCodeIsAWard() {
        RowClassification row = classifier.classifyRow(List.of("1", "Osisioma", "07"));

        assertThat(row.category()).isEqualTo(RowCategory.WARD_RECORD);
        assertThat(row.wardName()).isEqualTo("OSISIOMA");
        assertThat(row.wardCode()).isEqualTo("07");
    }

    /**
     * Ensures rows without any plausible code are noise.
     */
    @Test
    void rowsWithoutCodesAreNoise() {
        assertThat(classifier.classifyRow(List.of("Total", "wards")).category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyRow(List.of("Abia", "Aba North", "Eziama")).category()).isEqualTo(RowCategory.NOISE);
    }

    /**
     * Verifies the bounds of a plausible code.
     */
    @Test
    void plausibleCodesAreShortAndContainDigits() {
        assertThat(classifier.isPlausibleCode("01")).isTrue();
        assertThat(classifier.isPlausibleCode(" a1 ")).isTrue();
        assertThat(classifier.isPlausibleCode("12345")).isTrue();
        assertThat(classifier.isPlausibleCode("123456")).isFalse();
        assertThat(classifier.isPlausibleCode("ABC")).isFalse();
        assertThat(classifier.isPlausibleCode("1-2")).isFalse();
        assertThat(classifier.isPlausibleCode(null)).isFalse();

        assertThat(RowClassifier.isNumericCode("07")).isTrue();
        assertThat(RowClassifier.isNumericCode("A7")).isFalse();
    }

    /**
     * Verifies that reference State names are banners, with a trailing STATE removed.
     */
    @Test
    void referenceStateLinesAreBannersWithStateSuffixRemoved() {
        assertThat(classifier.classifyLine("ABIA STATE").bannerName()).isEqualTo("ABIA");
        assertThat(classifier.classifyLine("  Akwa   Ibom ").bannerName()).isEqualTo("AKWA IBOM");
        assertThat(classifier.classifyLine("FCT").category()).isEqualTo(RowCategory.REGION_BANNER);
    }

    /**
     * Verifies that short all-caps lines without digits are banners.
     */
    @Test
    void upperCaseLinesWithoutDigitsAreBanners() {
        RowClassification banner = classifier.classifyLine("NORTHERN ZONE");

        assertThat(banner.category()).isEqualTo(RowCategory.REGION_BANNER);
        assertThat(banner.bannerName()).isEqualTo("NORTHERN ZONE");
    }

    /**
     * Ensures lines failing the length, case, digit or keyword checks are not banners.
     */
    @Test
    void bannerCandidatesFailingBoundsOrKeywordsAreRejected() {
        assertThat(classifier.classifyLine("ABA NORTH 01").category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyLine("Northern zone").category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyLine("AB").category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyLine("INDEPENDENT NATIONAL ELECTORAL COMMISSION OF NIGERIA").category())
                .isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyLine("PAGE TWO").category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyLine("LGA NAME WARD NAME").category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyLine("--- *** ---").category()).isEqualTo(RowCategory.NOISE);
        assertThat(classifier.classifyLine("   ").category()).isEqualTo(RowCategory.NOISE);
    }

    /**
     * Ensures a code in the ward-name column yields a plain LGA record and no ward.
     */
    @Test
    void bareCodeInWardColumnDoesNotBecomeAWard() {
        RowClassification threeCells = classifier.classifyRow(List.of("Ada", "01", "02"));
        RowClassification fourCells = classifier.classifyRow(List.of("Ada", "01", "02", "03"));

        assertThat(threeCells.category()).isEqualTo(RowCategory.LGA_RECORD);
        assertThat(threeCells.lgaName()).isEqualTo("ADA");
        assertThat(threeCells.carriesWard()).isFalse();
        assertThat(threeCells.wardName()).isNull();
        assertThat(fourCells.carriesWard()).isFalse();
    }
}
